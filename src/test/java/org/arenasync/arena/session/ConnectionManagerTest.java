package org.arenasync.arena.session;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.arenasync.arena.api.PlayerId;
import org.arenasync.arena.api.SessionId;
import org.arenasync.arena.broadcast.Broadcaster;
import org.arenasync.arena.broadcast.RecordingFrameSink;
import org.arenasync.arena.chat.ChatScope;
import org.arenasync.arena.chat.ChatService;
import org.arenasync.arena.chat.WordListModerationFilter;
import org.arenasync.arena.encoding.SnapshotEncoder;
import org.arenasync.arena.leaderboard.LeaderboardService;
import org.arenasync.arena.persistence.BoardScope;
import org.arenasync.arena.persistence.InMemoryPlayerStore;
import org.arenasync.arena.persistence.PeriodicScore;
import org.arenasync.arena.persistence.PersistenceGateway;
import org.arenasync.arena.persistence.ScorePeriod;
import org.arenasync.arena.protocol.FrameCodec;
import org.arenasync.arena.protocol.FrameKind;
import org.arenasync.arena.protocol.InboundMessage;
import org.arenasync.arena.protocol.NoticeCode;
import org.arenasync.arena.world.PlayerEvent;
import org.arenasync.arena.world.Region;
import org.arenasync.arena.world.TickInput;
import org.arenasync.junit.extensions.logging.ExpectLog;
import org.arenasync.junit.extensions.logging.LogLevel;
import org.arenasync.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests handshake admission, the session state machine, inbound routing and closing.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConnectionManagerTest {

    private static final Instant T0 = Instant.parse("2026-06-01T18:00:00Z");
    private static final String SECRET = "test-secret-0123456789";
    private static final String BROWSER = "Mozilla/5.0 Firefox/128.0";

    private final Clock clock = Clock.fixed(T0, ZoneOffset.UTC);
    private final HmacTokenVerifier verifier = new HmacTokenVerifier(SECRET, clock);

    private InMemoryPlayerStore store;
    private PersistenceGateway gateway;
    private SnapshotEncoder encoder;
    private Broadcaster broadcaster;
    private LeaderboardService leaderboard;
    private ConnectionManager manager;

    @BeforeEach
    void setUp() {
        manager = newManager(ConfigFactory.empty(), ConfigFactory.parseMap(Map.of("burst", 100)));
    }

    @AfterEach
    void tearDown() {
        store.setAvailable(true);
        gateway.shutdown(Duration.ofSeconds(1));
        broadcaster.shutdown();
    }

    private ConnectionManager newManager(Config sessions, Config rateLimit) {
        store = new InMemoryPlayerStore("store", ConfigFactory.empty());
        gateway = new PersistenceGateway("persistence", ConfigFactory.parseMap(Map.of(
            "initialBackoffMs", 10, "maxBackoffMs", 20)), store);
        encoder = new SnapshotEncoder("encoder", ConfigFactory.empty());
        broadcaster = new Broadcaster("broadcaster", ConfigFactory.empty(), encoder);
        leaderboard = new LeaderboardService("leaderboard", ConfigFactory.empty(), clock);
        ChatService chat = new ChatService("chat", ConfigFactory.empty(),
            new WordListModerationFilter(ConfigFactory.parseMap(Map.of("words", List.of("darn")))), broadcaster, () -> 0L);
        return new ConnectionManager("connections", sessions, verifier, new UserAgentBotClassifier(ConfigFactory.empty()),
            new IpRateLimiter(rateLimit), gateway, broadcaster, encoder, chat, leaderboard, clock, () -> 0L);
    }

    private static Handshake handshake(String token, String name, String team, RecordingFrameSink sink) {
        return new Handshake("10.0.0.1", BROWSER, token, name, team, sink);
    }

    private String token(String playerId) {
        return verifier.issue(new PlayerId(playerId), T0.plusSeconds(3600));
    }

    private SessionView view(SessionId id) {
        return manager.session(id).orElseThrow();
    }

    @Nested
    @DisplayName("Handshake")
    class HandshakeTests {

        @Test
        @DisplayName("Anonymous players get an ephemeral identity and an accepted notice")
        void anonymous_isUnverified() throws Exception {
            RecordingFrameSink sink = new RecordingFrameSink();

            SessionId id = manager.open(handshake(null, "  Ana  ", "red", sink));

            SessionView view = view(id);
            assertEquals(SessionState.AUTHENTICATED, view.state());
            assertEquals(TrustLevel.UNVERIFIED, view.trust());
            assertThat(view.playerId().isEphemeral()).isTrue();
            assertThat(view.displayName()).isEqualTo("Ana");
            assertThat(view.teamId()).isEqualTo("red");
            await().atMost(Duration.ofSeconds(2)).until(() -> sink.frames(FrameKind.NOTICE).size() == 1);
            FrameCodec.Notice notice = FrameCodec.decodeNotice(sink.frames().get(0).payload());
            assertThat(notice.code()).isEqualTo(NoticeCode.SESSION_ACCEPTED);
            assertThat(notice.detail()).isEqualTo(id.value());
        }

        @Test
        @DisplayName("A first-time verified player is stored as a critical write")
        void newVerifiedPlayer_isStored() throws Exception {
            SessionId id = manager.open(handshake(token("ana"), null, null, new RecordingFrameSink()));

            assertEquals(TrustLevel.VERIFIED, view(id).trust());
            assertThat(view(id).displayName()).isEqualTo("Player-ana");
            await().atMost(Duration.ofSeconds(2)).until(() -> store.read(new PlayerId("ana")).isPresent());
            assertThat(store.read(new PlayerId("ana")).orElseThrow().plays()).isEqualTo(1);
        }

        @Test
        @DisplayName("Bad tokens are refused and leave no session behind")
        void badToken_isRefused() {
            AuthException e = assertThrows(AuthException.class,
                () -> manager.open(handshake("ana.1.bogus", null, null, new RecordingFrameSink())));

            assertEquals(AuthError.INVALID_TOKEN, e.getError());
            assertThat(manager.sessionCount()).isZero();
            assertThat(broadcaster.sessionCount()).isZero();
        }

        @Test
        @DisplayName("Handshakes beyond the per-address burst are rate limited")
        void handshakeFlood_isRateLimited() throws Exception {
            tearDown();
            manager = newManager(ConfigFactory.empty(), ConfigFactory.parseMap(Map.of("burst", 1, "periodMs", 60000)));
            manager.open(handshake(null, null, null, new RecordingFrameSink()));

            AuthException e = assertThrows(AuthException.class,
                () -> manager.open(handshake(null, null, null, new RecordingFrameSink())));

            assertEquals(AuthError.RATE_LIMITED, e.getError());
        }

        @Test
        @DisplayName("The session limit is enforced")
        void sessionLimit_isEnforced() throws Exception {
            tearDown();
            manager = newManager(ConfigFactory.parseMap(Map.of("maxSessions", 1)), ConfigFactory.empty());
            manager.open(handshake(null, null, null, new RecordingFrameSink()));

            AuthException e = assertThrows(AuthException.class,
                () -> manager.open(new Handshake("10.0.0.2", BROWSER, null, null, null, new RecordingFrameSink())));

            assertEquals(AuthError.SERVER_FULL, e.getError());
        }

        @Test
        @DisplayName("Concurrent handshakes never push the table past the session limit")
        void concurrentHandshakes_respectLimit() throws Exception {
            tearDown();
            manager = newManager(ConfigFactory.parseMap(Map.of("maxSessions", 5)), ConfigFactory.empty());
            int attempts = 32;
            ExecutorService pool = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger admitted = new AtomicInteger();
            AtomicInteger full = new AtomicInteger();
            List<Future<?>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < attempts; i++) {
                    Handshake handshake = new Handshake("10.0.1." + i, BROWSER, null, null, null, new RecordingFrameSink());
                    futures.add(pool.submit(() -> {
                        start.await();
                        try {
                            manager.open(handshake);
                            admitted.incrementAndGet();
                        } catch (AuthException e) {
                            assertEquals(AuthError.SERVER_FULL, e.getError());
                            full.incrementAndGet();
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(5, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertThat(admitted.get()).isEqualTo(5);
            assertThat(full.get()).isEqualTo(attempts - 5);
            assertThat(manager.sessionCount()).isEqualTo(5);

            SessionId any = manager.sessions().get(0).sessionId();
            manager.close(any, CloseReason.CLIENT_LEAVE);
            manager.open(new Handshake("10.0.2.1", BROWSER, null, null, null, new RecordingFrameSink()));
            assertThat(manager.sessionCount()).isEqualTo(5);
        }

        @Test
        @DisplayName("A refused handshake gives its reserved slot back")
        void refusedHandshake_releasesSlot() throws Exception {
            tearDown();
            manager = newManager(ConfigFactory.parseMap(Map.of("maxSessions", 1)), ConfigFactory.empty());

            assertThrows(AuthException.class, () -> manager.open(handshake("ana.1.bogus", null, null, new RecordingFrameSink())));

            manager.open(handshake(null, null, null, new RecordingFrameSink()));
            assertThat(manager.sessionCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("A second session of the same player supersedes the first and keeps the standing")
        void samePlayer_supersedesOlderSession() throws Exception {
            RecordingFrameSink first = new RecordingFrameSink();
            SessionId older = manager.open(handshake(token("ana"), "ana", null, first));
            manager.route(older, new InboundMessage.Subscribe(Region.ALL));
            manager.updateScores(Map.of(older, 50L));
            leaderboard.commitTick(1);

            SessionId newer = manager.open(new Handshake("10.0.0.9", BROWSER, token("ana"), "ana", null, new RecordingFrameSink()));
            manager.route(newer, new InboundMessage.Subscribe(Region.ALL));
            manager.updateScores(Map.of(newer, 70L, older, 999L));
            leaderboard.commitTick(2);

            assertThat(manager.session(older)).isEmpty();
            assertThat(first.closeCode()).isEqualTo(CloseReason.SUPERSEDED.code());
            assertThat(manager.sessionCount()).isEqualTo(1);
            assertThat(leaderboard.publish().entries()).singleElement().satisfies(entry -> {
                assertThat(entry.playerId()).isEqualTo(new PlayerId("ana"));
                assertThat(entry.score()).isEqualTo(70L);
            });
            assertThat(manager.getMetrics().get("sessions_superseded")).isEqualTo(1L);

            manager.close(newer, CloseReason.CLIENT_LEAVE);
            leaderboard.commitTick(3);
            assertThat(leaderboard.publish().entries()).isEmpty();
        }

        @Test
        @DisplayName("Closing a verified session feeds the periodic player and team boards")
        void close_feedsPeriodicBoards() throws Exception {
            SessionId id = manager.open(handshake(token("ana"), "Ana", "red", new RecordingFrameSink()));
            manager.route(id, new InboundMessage.Subscribe(Region.ALL));
            manager.updateScores(Map.of(id, 120L));

            manager.close(id, CloseReason.CLIENT_LEAVE);

            await().atMost(Duration.ofSeconds(2))
                .until(() -> !store.topScores(BoardScope.TEAM, ScorePeriod.DAY, T0, 10).isEmpty());
            assertThat(store.topScores(BoardScope.TEAM, ScorePeriod.DAY, T0, 10))
                .singleElement().satisfies(row -> {
                    assertThat(row.key()).isEqualTo("red");
                    assertThat(row.score()).isEqualTo(120L);
                });
            assertThat(store.topScores(BoardScope.PLAYER, ScorePeriod.WEEK, T0, 10))
                .extracting(PeriodicScore::displayName).containsExactly("Ana");
        }

        @Test
        @DisplayName("Suspected bots are admitted unranked, or refused when configured")
        void bots_areUnrankedOrRefused() throws Exception {
            SessionId bot = manager.open(new Handshake("10.0.0.3", "curl/8.4", null, null, null, new RecordingFrameSink()));
            manager.route(bot, new InboundMessage.Subscribe(Region.ALL));
            manager.updateScores(Map.of(bot, 99L));
            leaderboard.commitTick(1);

            assertEquals(TrustLevel.SUSPECTED_BOT, view(bot).trust());
            assertThat(view(bot).score()).isEqualTo(99);
            assertThat(leaderboard.publish().entries()).isEmpty();

            tearDown();
            manager = newManager(ConfigFactory.parseMap(Map.of("rejectBots", true)), ConfigFactory.empty());
            AuthException e = assertThrows(AuthException.class,
                () -> manager.open(new Handshake("10.0.0.3", "curl/8.4", null, null, null, new RecordingFrameSink())));
            assertEquals(AuthError.BOT_REJECTED, e.getError());
        }

        @Test
        @DisplayName("A store outage degrades verified players to an ephemeral identity")
        @ExpectLog(level = LogLevel.WARN, messagePattern = "Player store unavailable while loading ana.*")
        @ExpectLog(level = LogLevel.WARN, messagePattern = "Player store unavailable, session .* ephemeral identity.*")
        void storeOutage_fallsBackToEphemeral() throws Exception {
            store.setAvailable(false);

            SessionId id = manager.open(handshake(token("ana"), "ana", null, new RecordingFrameSink()));

            assertThat(view(id).playerId().isEphemeral()).isTrue();
            assertThat(manager.getMetrics().get("ephemeral_fallbacks")).isEqualTo(1L);
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Subscribing activates the session and announces the join to the tick")
        void subscribe_activates() throws Exception {
            SessionId id = manager.open(handshake(null, "ana", null, new RecordingFrameSink()));

            assertEquals(RouteResult.IGNORED, manager.route(id, new InboundMessage.Input(1, 1, 0, 0, false)));
            assertEquals(RouteResult.IGNORED, manager.route(id, new InboundMessage.Ack(1)));
            assertEquals(RouteResult.ACCEPTED, manager.route(id, new InboundMessage.Subscribe(Region.ALL)));
            assertEquals(RouteResult.ACCEPTED, manager.route(id, new InboundMessage.Input(1, 1, 0, 0, false)));

            TickInput input = manager.drainTickInput(1);
            assertEquals(SessionState.ACTIVE, view(id).state());
            assertThat(input.events()).singleElement().satisfies(event -> {
                assertThat(event.kind()).isEqualTo(PlayerEvent.Kind.JOINED);
                assertThat(event.sessionId()).isEqualTo(id);
            });
            assertThat(input.inputs()).hasSize(1);
            assertThat(manager.drainTickInput(2).inputs()).isEmpty();
        }

        @Test
        @DisplayName("Repeated malformed messages drain the session as a protocol violation")
        @ExpectLog(level = LogLevel.WARN, messagePattern = "Dropped malformed message.*", occurrences = 3)
        void malformedMessages_drainSession() throws Exception {
            SessionId id = manager.open(handshake(null, null, null, new RecordingFrameSink()));

            assertEquals(RouteResult.MALFORMED, manager.routeRaw(id, new byte[] {99}));
            assertEquals(RouteResult.MALFORMED, manager.routeRaw(id, new byte[0]));
            assertEquals(SessionState.AUTHENTICATED, view(id).state());
            assertEquals(RouteResult.MALFORMED, manager.routeRaw(id, new byte[] {1}));

            assertEquals(SessionState.DRAINING, view(id).state());
            assertEquals(CloseReason.PROTOCOL_VIOLATION, view(id).closeReason());
        }

        @Test
        @DisplayName("A well-formed message resets the malformed counter")
        @ExpectLog(level = LogLevel.WARN, messagePattern = "Dropped malformed message.*", occurrences = 4)
        void wellFormedMessage_resetsCounter() throws Exception {
            SessionId id = manager.open(handshake(null, null, null, new RecordingFrameSink()));

            manager.routeRaw(id, new byte[] {99});
            manager.routeRaw(id, new byte[] {99});
            manager.routeRaw(id, FrameCodec.encodeInbound(new InboundMessage.Subscribe(Region.ALL)));
            manager.routeRaw(id, new byte[] {99});
            manager.routeRaw(id, new byte[] {99});

            assertEquals(SessionState.ACTIVE, view(id).state());
        }

        @Test
        @DisplayName("Leaving drains, the sweep closes once flushed, the final score is stored")
        void leave_drainsThenCloses() throws Exception {
            RecordingFrameSink sink = new RecordingFrameSink();
            SessionId id = manager.open(handshake(token("ana"), "ana", null, sink));
            manager.route(id, new InboundMessage.Subscribe(Region.ALL));
            manager.updateScores(Map.of(id, 120L));

            assertEquals(RouteResult.ACCEPTED, manager.route(id, new InboundMessage.Leave()));
            assertEquals(SessionState.DRAINING, view(id).state());
            assertEquals(RouteResult.IGNORED, manager.route(id, new InboundMessage.Input(1, 0, 0, 0, true)));

            await().atMost(Duration.ofSeconds(2)).until(() -> broadcaster.pendingFrames(id) == 0);
            manager.sweep(T0);

            assertThat(manager.session(id)).isEmpty();
            assertThat(sink.closeCode()).isEqualTo(CloseReason.CLIENT_LEAVE.code());
            await().atMost(Duration.ofSeconds(2))
                .until(() -> store.read(new PlayerId("ana")).map(r -> r.bestScore() == 120).orElse(false));
            assertThat(manager.drainTickInput(1).events()).extracting(PlayerEvent::kind)
                .containsExactly(PlayerEvent.Kind.JOINED, PlayerEvent.Kind.LEFT);
        }

        @Test
        @DisplayName("Silent sessions time out")
        void idleSession_timesOut() throws Exception {
            RecordingFrameSink sink = new RecordingFrameSink();
            SessionId id = manager.open(handshake(null, null, null, sink));

            manager.sweep(T0.plusSeconds(10));
            assertEquals(SessionState.AUTHENTICATED, view(id).state());
            manager.sweep(T0.plusSeconds(31));

            assertThat(manager.session(id)).isEmpty();
            assertThat(sink.closeCode()).isEqualTo(CloseReason.IDLE_TIMEOUT.code());
        }

        @Test
        @DisplayName("Slow consumers are drained")
        @ExpectLog(level = LogLevel.WARN, messagePattern = "Draining slow consumer.*")
        void slowConsumer_isDrained() throws Exception {
            SessionId id = manager.open(handshake(null, null, null, new RecordingFrameSink()));

            manager.onSlowConsumer(id);

            assertEquals(CloseReason.SLOW_CONSUMER, view(id).closeReason());
        }

        @Test
        @DisplayName("Closing twice or closing an unknown session is harmless")
        void close_isIdempotent() throws Exception {
            RecordingFrameSink sink = new RecordingFrameSink();
            SessionId id = manager.open(handshake(null, null, null, sink));

            manager.close(id, CloseReason.TRANSPORT_ERROR);
            manager.close(id, CloseReason.SERVER_SHUTDOWN);
            manager.close(new SessionId(999), CloseReason.CLIENT_LEAVE);

            assertThat(sink.closeCode()).isEqualTo(CloseReason.TRANSPORT_ERROR.code());
            assertEquals(RouteResult.IGNORED, manager.route(id, new InboundMessage.Ack(1)));
        }
    }

    @Nested
    @DisplayName("Chat routing")
    class ChatRouting {

        @Test
        @DisplayName("Team chat reaches team mates only, with disallowed words masked")
        void teamChat_reachesTeamOnly() throws Exception {
            RecordingFrameSink red1 = new RecordingFrameSink();
            RecordingFrameSink red2 = new RecordingFrameSink();
            RecordingFrameSink blue = new RecordingFrameSink();
            SessionId sender = manager.open(handshake(null, "r1", "red", red1));
            manager.open(new Handshake("10.0.0.2", BROWSER, null, "r2", "red", red2));
            manager.open(new Handshake("10.0.0.3", BROWSER, null, "b1", "blue", blue));

            assertEquals(RouteResult.ACCEPTED, manager.route(sender, new InboundMessage.Chat(ChatScope.TEAM, "", "darn it")));

            await().atMost(Duration.ofSeconds(2)).until(() -> red2.frames(FrameKind.CHAT).size() == 1);
            assertThat(FrameCodec.decodeChat(red2.frames(FrameKind.CHAT).get(0).payload()).text()).isEqualTo("**** it");
            await().atMost(Duration.ofSeconds(2)).until(() -> red1.frames(FrameKind.CHAT).size() == 1);
            assertThat(blue.frames(FrameKind.CHAT)).isEmpty();
        }

        @Test
        @DisplayName("Whispers to unknown players are refused with a notice")
        void whisperToUnknown_isRefused() throws Exception {
            RecordingFrameSink sink = new RecordingFrameSink();
            SessionId sender = manager.open(handshake(null, "ana", null, sink));

            assertEquals(RouteResult.REJECTED, manager.route(sender, new InboundMessage.Chat(ChatScope.WHISPER, "nobody", "hi")));

            await().atMost(Duration.ofSeconds(2)).until(() -> sink.frames(FrameKind.NOTICE).size() == 2);
            assertThat(FrameCodec.decodeNotice(sink.frames(FrameKind.NOTICE).get(1).payload()).code())
                .isEqualTo(NoticeCode.CHAT_REJECTED);
        }
    }
}
