package org.arenasync.arena.session;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.arenasync.arena.api.PlayerId;
import org.arenasync.arena.api.SessionId;
import org.arenasync.arena.broadcast.Broadcaster;
import org.arenasync.arena.broadcast.IDeliveryListener;
import org.arenasync.arena.chat.ChatOutcome;
import org.arenasync.arena.chat.ChatParticipant;
import org.arenasync.arena.chat.ChatService;
import org.arenasync.arena.encoding.SnapshotEncoder;
import org.arenasync.arena.leaderboard.LeaderboardService;
import org.arenasync.arena.persistence.LoadResult;
import org.arenasync.arena.persistence.PersistenceGateway;
import org.arenasync.arena.persistence.PlayerRecord;
import org.arenasync.arena.persistence.WriteClass;
import org.arenasync.arena.protocol.FrameCodec;
import org.arenasync.arena.protocol.InboundMessage;
import org.arenasync.arena.protocol.NoticeCode;
import org.arenasync.arena.protocol.ProtocolException;
import org.arenasync.arena.resources.AbstractResource;
import org.arenasync.arena.world.InputCommand;
import org.arenasync.arena.world.PlayerEvent;
import org.arenasync.arena.world.TickInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Owns the session table and drives every session through
 * {@code CONNECTING -> AUTHENTICATED -> ACTIVE -> DRAINING -> CLOSED}.
 * <p>
 * Network threads call {@link #open}, {@link #route} and {@link #close}; the tick thread
 * calls {@link #drainTickInput}, {@link #updateScores} and {@link #sweep}. Inputs and
 * join/leave events reach the tick thread through concurrent inboxes. Each session is
 * guarded by its own monitor; the table itself is a concurrent map. Capacity is
 * reserved atomically before a handshake proceeds. A verified player has at most one
 * session: a new handshake closes the older one with {@link CloseReason#SUPERSEDED}.
 * <p>
 * <strong>Configuration Options:</strong>
 * <ul>
 *   <li><b>maxSessions</b>: concurrent session limit (default: 256)</li>
 *   <li><b>idleTimeoutMs</b>: silence after which a session is drained (default: 30000)</li>
 *   <li><b>drainGraceMs</b>: longest wait for the final acknowledgment (default: 2000)</li>
 *   <li><b>maxMalformed</b>: consecutive malformed messages tolerated (default: 3)</li>
 *   <li><b>rejectBots</b>: refuse suspected bots instead of admitting them unranked (default: false)</li>
 * </ul>
 */
public class ConnectionManager extends AbstractResource implements IDeliveryListener {

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final ITokenVerifier tokenVerifier;
    private final IBotClassifier botClassifier;
    private final IpRateLimiter rateLimiter;
    private final PersistenceGateway gateway;
    private final Broadcaster broadcaster;
    private final SnapshotEncoder encoder;
    private final ChatService chat;
    private final LeaderboardService leaderboard;
    private final Clock clock;
    private final LongSupplier currentTick;

    private final int maxSessions;
    private final Duration idleTimeout;
    private final Duration drainGrace;
    private final int maxMalformed;
    private final boolean rejectBots;

    private final Map<SessionId, Session> sessions = new ConcurrentHashMap<>();
    /** Open session of each non-ephemeral player; a newer handshake supersedes the older session. */
    private final Map<PlayerId, SessionId> sessionsByPlayer = new ConcurrentHashMap<>();
    /** Slots taken by sessions and by handshakes in progress, never above maxSessions. */
    private final AtomicInteger occupiedSlots = new AtomicInteger();
    private final AtomicLong nextSessionId = new AtomicLong();
    private final ConcurrentLinkedQueue<InputCommand> inputs = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<PlayerEvent> events = new ConcurrentLinkedQueue<>();

    private final AtomicLong sessionsOpened = new AtomicLong();
    private final AtomicLong handshakesRejected = new AtomicLong();
    private final AtomicLong malformedMessages = new AtomicLong();
    private final AtomicLong ephemeralFallbacks = new AtomicLong();
    private final AtomicLong sessionsSuperseded = new AtomicLong();

    public ConnectionManager(String name, Config options, ITokenVerifier tokenVerifier, IBotClassifier botClassifier,
                             IpRateLimiter rateLimiter, PersistenceGateway gateway, Broadcaster broadcaster,
                             SnapshotEncoder encoder, ChatService chat, LeaderboardService leaderboard,
                             Clock clock, LongSupplier currentTick) {
        super(name, options);
        Config defaults = ConfigFactory.parseMap(Map.of(
            "maxSessions", 256,
            "idleTimeoutMs", 30000,
            "drainGraceMs", 2000,
            "maxMalformed", 3,
            "rejectBots", false
        ));
        Config config = options.withFallback(defaults);
        this.tokenVerifier = tokenVerifier;
        this.botClassifier = botClassifier;
        this.rateLimiter = rateLimiter;
        this.gateway = gateway;
        this.broadcaster = broadcaster;
        this.encoder = encoder;
        this.chat = chat;
        this.leaderboard = leaderboard;
        this.clock = clock;
        this.currentTick = currentTick;
        this.maxSessions = config.getInt("maxSessions");
        this.idleTimeout = Duration.ofMillis(config.getLong("idleTimeoutMs"));
        this.drainGrace = Duration.ofMillis(config.getLong("drainGraceMs"));
        this.maxMalformed = config.getInt("maxMalformed");
        this.rejectBots = config.getBoolean("rejectBots");
        broadcaster.setDeliveryListener(this);
    }

    // ---------------------------------------------------------------- handshake

    /**
     * Authenticates a connection and creates its session.
     *
     * @return The new session, in state AUTHENTICATED.
     * @throws AuthException if the handshake is refused; no session exists afterwards.
     */
    public SessionId open(Handshake handshake) throws AuthException {
        try {
            return authenticate(handshake);
        } catch (AuthException e) {
            handshakesRejected.incrementAndGet();
            log.info("Refused handshake from {}: {} ({})", handshake.remoteAddress(), e.getError(), e.getMessage());
            throw e;
        }
    }

    private SessionId authenticate(Handshake handshake) throws AuthException {
        if (rateLimiter.shouldLimit(handshake.remoteAddress())) {
            throw new AuthException(AuthError.RATE_LIMITED, "Too many handshakes from " + handshake.remoteAddress());
        }
        if (!reserveSlot()) {
            throw new AuthException(AuthError.SERVER_FULL, "Session limit of " + maxSessions + " reached");
        }
        boolean admitted = false;
        try {
            SessionId sessionId = admit(handshake);
            admitted = true;
            return sessionId;
        } finally {
            if (!admitted) {
                occupiedSlots.decrementAndGet();
            }
        }
    }

    private boolean reserveSlot() {
        while (true) {
            int occupied = occupiedSlots.get();
            if (occupied >= maxSessions) {
                return false;
            }
            if (occupiedSlots.compareAndSet(occupied, occupied + 1)) {
                return true;
            }
        }
    }

    private SessionId admit(Handshake handshake) throws AuthException {
        TrustLevel trust = botClassifier.classify(handshake);
        if (trust == TrustLevel.SUSPECTED_BOT && rejectBots) {
            throw new AuthException(AuthError.BOT_REJECTED, "Automated client rejected");
        }

        Instant now = clock.instant();
        SessionId sessionId = new SessionId(nextSessionId.incrementAndGet());
        PlayerId playerId;
        PlayerRecord stored = null;
        String name = sanitizeName(handshake.requestedName());

        if (!handshake.hasToken()) {
            playerId = PlayerId.ephemeral();
        } else {
            playerId = tokenVerifier.verify(handshake.token());
            if (trust != TrustLevel.SUSPECTED_BOT) {
                trust = TrustLevel.VERIFIED;
            }
            LoadResult loaded = gateway.loadPlayer(playerId);
            if (loaded instanceof LoadResult.Found found) {
                PlayerRecord record = found.record();
                if (name == null) {
                    name = record.displayName();
                }
                stored = new PlayerRecord(playerId, name, record.bestScore(), record.moderationFlags(), now,
                    record.plays() + 1, record.createdAt());
            } else if (loaded instanceof LoadResult.NotFound) {
                if (name == null) {
                    name = "Player-" + playerId.value();
                }
                stored = PlayerRecord.firstSeen(playerId, name, now);
                gateway.upsertPlayer(stored, WriteClass.CRITICAL);
            } else {
                ephemeralFallbacks.incrementAndGet();
                log.warn("Player store unavailable, session {} continues with an ephemeral identity instead of {}", sessionId, playerId);
                playerId = PlayerId.ephemeral();
            }
        }
        if (name == null) {
            name = "Guest-" + sessionId.value();
        }

        Session session = new Session(sessionId, playerId, name, blankToNull(handshake.teamId()), trust, handshake, now, stored);
        sessions.put(sessionId, session);
        SessionId superseded = session.isEphemeral() ? null : sessionsByPlayer.put(playerId, sessionId);
        broadcaster.register(sessionId, handshake.sink());
        broadcaster.sendCritical(sessionId, FrameCodec.encodeNotice(currentTick.getAsLong(), NoticeCode.SESSION_ACCEPTED,
            sessionId.value(), playerId.value()));
        sessionsOpened.incrementAndGet();
        log.debug("Opened session {} for {} ({}, {})", sessionId, playerId, name, trust);
        if (superseded != null) {
            sessionsSuperseded.incrementAndGet();
            log.info("Session {} of {} superseded by {}", superseded, playerId, sessionId);
            close(superseded, CloseReason.SUPERSEDED);
        }
        return sessionId;
    }

    private static String sanitizeName(String requested) {
        if (requested == null) {
            return null;
        }
        String name = requested.strip();
        if (name.isEmpty()) {
            return null;
        }
        return name.length() > 24 ? name.substring(0, 24) : name;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }

    // ---------------------------------------------------------------- inbound

    /**
     * Decodes and routes raw client bytes. Malformed bytes are dropped and counted.
     */
    public RouteResult routeRaw(SessionId sessionId, byte[] payload) {
        InboundMessage message;
        try {
            message = FrameCodec.decodeInbound(payload);
        } catch (ProtocolException e) {
            return malformed(sessionId, e);
        }
        return route(sessionId, message);
    }

    /**
     * Routes one well-formed message according to the session's state.
     */
    public RouteResult route(SessionId sessionId, InboundMessage message) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return RouteResult.IGNORED;
        }
        ChatRequest chatRequest = null;
        synchronized (session) {
            if (session.state == SessionState.CLOSED) {
                return RouteResult.IGNORED;
            }
            session.lastSeen = clock.instant();
            session.consecutiveMalformed = 0;

            if (message instanceof InboundMessage.Ack ack) {
                if (session.state != SessionState.ACTIVE && session.state != SessionState.DRAINING) {
                    return RouteResult.IGNORED;
                }
                session.lastAckedTick = Math.max(session.lastAckedTick, ack.tick());
                encoder.acknowledge(sessionId, ack.tick());
                return RouteResult.ACCEPTED;
            }
            if (message instanceof InboundMessage.Input input) {
                if (session.state != SessionState.ACTIVE) {
                    return RouteResult.IGNORED;
                }
                inputs.add(new InputCommand(sessionId, input.clientTick(), input.moveX(), input.moveY(), input.aim(), input.action()));
                return RouteResult.ACCEPTED;
            }
            if (message instanceof InboundMessage.Subscribe subscribe) {
                if (!session.isOpen()) {
                    return RouteResult.IGNORED;
                }
                session.region = subscribe.region();
                broadcaster.subscribe(sessionId, subscribe.region());
                if (session.state == SessionState.AUTHENTICATED) {
                    session.state = SessionState.ACTIVE;
                    session.inWorld = true;
                    events.add(PlayerEvent.joined(sessionId, session.playerId, session.displayName));
                    log.debug("Session {} is active", sessionId);
                }
                return RouteResult.ACCEPTED;
            }
            if (message instanceof InboundMessage.Leave) {
                beginDrain(session, CloseReason.CLIENT_LEAVE);
                return RouteResult.ACCEPTED;
            }
            if (!session.isOpen()) {
                return RouteResult.IGNORED;
            }
            chatRequest = new ChatRequest(new ChatParticipant(sessionId, session.displayName, session.teamId),
                (InboundMessage.Chat) message);
        }
        return routeChat(session, chatRequest);
    }

    private record ChatRequest(ChatParticipant sender, InboundMessage.Chat message) {
    }

    private RouteResult routeChat(Session session, ChatRequest request) {
        InboundMessage.Chat message = request.message();
        ChatOutcome outcome = chat.submit(request.sender(), message.scope(), message.target(), message.text(), chatRoster());
        switch (outcome) {
            case DELIVERED:
                return RouteResult.ACCEPTED;
            case DELIVERED_FILTERED:
                synchronized (session) {
                    session.moderationFlags.add("chat_filtered");
                }
                return RouteResult.ACCEPTED;
            case REJECTED:
                synchronized (session) {
                    session.moderationFlags.add("chat_rejected");
                }
                notice(session.id, NoticeCode.CHAT_REJECTED, "Message rejected by moderation");
                return RouteResult.REJECTED;
            case RATE_LIMITED:
                notice(session.id, NoticeCode.CHAT_RATE_LIMITED, "Slow down");
                return RouteResult.REJECTED;
            default:
                notice(session.id, NoticeCode.CHAT_REJECTED, outcome.name());
                return RouteResult.REJECTED;
        }
    }

    private List<ChatParticipant> chatRoster() {
        List<ChatParticipant> roster = new ArrayList<>();
        for (Session session : sessions.values()) {
            synchronized (session) {
                if (session.isOpen()) {
                    roster.add(new ChatParticipant(session.id, session.displayName, session.teamId));
                }
            }
        }
        return roster;
    }

    private RouteResult malformed(SessionId sessionId, ProtocolException cause) {
        malformedMessages.incrementAndGet();
        Session session = sessions.get(sessionId);
        if (session == null) {
            return RouteResult.IGNORED;
        }
        synchronized (session) {
            if (session.state == SessionState.CLOSED) {
                return RouteResult.IGNORED;
            }
            session.lastSeen = clock.instant();
            session.consecutiveMalformed++;
            log.warn("Dropped malformed message {} of {} from session {}: {}",
                session.consecutiveMalformed, maxMalformed, sessionId, cause.getMessage());
            if (session.consecutiveMalformed >= maxMalformed && session.isOpen()) {
                recordError("PROTOCOL_VIOLATION", "Too many malformed messages", "session=" + sessionId);
                beginDrain(session, CloseReason.PROTOCOL_VIOLATION);
            }
        }
        return RouteResult.MALFORMED;
    }

    // ---------------------------------------------------------------- tick thread

    /**
     * Collects the inputs and join/leave events received since the previous tick.
     */
    public TickInput drainTickInput(long tick) {
        List<PlayerEvent> drainedEvents = new ArrayList<>();
        PlayerEvent event;
        while ((event = events.poll()) != null) {
            drainedEvents.add(event);
        }
        List<InputCommand> drainedInputs = new ArrayList<>();
        InputCommand input;
        while ((input = inputs.poll()) != null) {
            drainedInputs.add(input);
        }
        return new TickInput(tick, drainedEvents, drainedInputs);
    }

    /**
     * Applies the simulation's per-session scores and forwards ranked ones to the leaderboard.
     * Suspected bots are never ranked.
     */
    public void updateScores(Map<SessionId, Long> scores) {
        for (Map.Entry<SessionId, Long> entry : scores.entrySet()) {
            Session session = sessions.get(entry.getKey());
            if (session == null) {
                continue;
            }
            synchronized (session) {
                if (session.state != SessionState.ACTIVE) {
                    continue;
                }
                session.score = entry.getValue();
                if (session.trust != TrustLevel.SUSPECTED_BOT && ownsPlayer(session)) {
                    leaderboard.recordScore(session.playerId, session.displayName, session.score);
                }
            }
        }
    }

    /**
     * Housekeeping: drains idle sessions and closes drained ones once their last world
     * frame is acknowledged or their grace period has elapsed.
     */
    public void sweep(Instant now) {
        for (Session session : sessions.values()) {
            CloseReason toClose = null;
            synchronized (session) {
                if (session.isOpen() && session.lastSeen.plus(idleTimeout).isBefore(now)) {
                    beginDrain(session, CloseReason.IDLE_TIMEOUT);
                }
                if (session.state == SessionState.DRAINING) {
                    if (isFlushed(session) || !now.isBefore(session.drainDeadline)) {
                        toClose = session.closeReason;
                    }
                }
            }
            if (toClose != null) {
                close(session.id, toClose);
            }
        }
    }

    private boolean isFlushed(Session session) {
        if (broadcaster.pendingFrames(session.id) > 0) {
            return false;
        }
        long lastSent = broadcaster.lastWorldTickSent(session.id);
        return lastSent < 0 || session.lastAckedTick >= lastSent;
    }

    // ---------------------------------------------------------------- closing

    /**
     * Moves an open session to DRAINING: world frames stop and the client is told why.
     * Must be called while holding the session's monitor.
     */
    private void beginDrain(Session session, CloseReason reason) {
        if (!session.isOpen()) {
            return;
        }
        session.state = SessionState.DRAINING;
        session.closeReason = reason;
        session.drainDeadline = clock.instant().plus(drainGrace);
        broadcaster.stopWorldFrames(session.id);
        leaveWorld(session);
        log.debug("Session {} draining: {}", session.id, reason);
        notice(session.id, reason.notice(), reason.name());
    }

    private void leaveWorld(Session session) {
        if (session.inWorld) {
            session.inWorld = false;
            events.add(PlayerEvent.left(session.id, session.playerId));
        }
        if (ownsPlayer(session)) {
            leaderboard.remove(session.playerId);
        }
    }

    /**
     * False for a session superseded by a newer one of the same player, whose standing
     * now belongs to the newer session.
     */
    private boolean ownsPlayer(Session session) {
        return session.isEphemeral() || session.id.equals(sessionsByPlayer.get(session.playerId));
    }

    private void notice(SessionId sessionId, NoticeCode code, String message) {
        broadcaster.sendCritical(sessionId, FrameCodec.encodeNotice(currentTick.getAsLong(), code, 0L, message));
    }

    /**
     * Closes a session immediately. The final score is written as a critical,
     * asynchronous write that outlives the session; pending frames and encoder state are
     * discarded afterwards.
     */
    public void close(SessionId sessionId, CloseReason reason) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return;
        }
        synchronized (session) {
            if (session.state == SessionState.CLOSED) {
                return;
            }
            if (session.closeReason == null) {
                session.closeReason = reason;
            }
            session.state = SessionState.CLOSED;
            leaveWorld(session);
        }
        if (sessions.remove(sessionId) != null) {
            occupiedSlots.decrementAndGet();
        }
        if (!session.isEphemeral()) {
            sessionsByPlayer.remove(session.playerId, sessionId);
        }
        if (!session.isEphemeral()) {
            Instant now = clock.instant();
            PlayerRecord last = session.finalRecord(now);
            gateway.upsertPlayer(last, session.finalScore(now), WriteClass.CRITICAL).whenComplete((ignored, failure) -> {
                if (failure != null) {
                    log.warn("Final score of {} was not stored: {}", last.playerId(), failure.getMessage());
                }
            });
        }
        broadcaster.unregister(sessionId);
        chat.forget(sessionId);
        try {
            session.sink.close(session.closeReason.code(), session.closeReason.name());
        } catch (RuntimeException e) {
            log.debug("Transport of session {} failed to close cleanly: {}", sessionId, e.getMessage());
        }
        log.info("Closed session {} of {} ({}), score {}", sessionId, session.playerId, session.closeReason, session.score);
    }

    /**
     * Closes every session with {@link CloseReason#SERVER_SHUTDOWN}.
     */
    public void closeAll() {
        for (SessionId sessionId : new ArrayList<>(sessions.keySet())) {
            close(sessionId, CloseReason.SERVER_SHUTDOWN);
        }
    }

    @Override
    public void onSlowConsumer(SessionId sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return;
        }
        synchronized (session) {
            if (session.isOpen()) {
                log.warn("Draining slow consumer {}", sessionId);
                beginDrain(session, CloseReason.SLOW_CONSUMER);
            }
        }
    }

    @Override
    public void onTransportFailure(SessionId sessionId, Exception cause) {
        close(sessionId, CloseReason.TRANSPORT_ERROR);
    }

    // ---------------------------------------------------------------- queries

    public Optional<Instant> lastSeen(SessionId sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return Optional.empty();
        }
        synchronized (session) {
            return Optional.of(session.lastSeen);
        }
    }

    public Optional<SessionView> session(SessionId sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return Optional.empty();
        }
        int pending = broadcaster.pendingFrames(sessionId);
        synchronized (session) {
            return Optional.of(session.view(pending));
        }
    }

    /**
     * All current sessions, ordered by id.
     */
    public List<SessionView> sessions() {
        List<SessionView> views = new ArrayList<>();
        for (Session session : sessions.values()) {
            int pending = broadcaster.pendingFrames(session.id);
            synchronized (session) {
                views.add(session.view(pending));
            }
        }
        views.sort(Comparator.comparingLong(view -> view.sessionId().value()));
        return views;
    }

    public int sessionCount() {
        return sessions.size();
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("sessions", sessions.size());
        metrics.put("sessions_opened", sessionsOpened.get());
        metrics.put("handshakes_rejected", handshakesRejected.get());
        metrics.put("malformed_messages", malformedMessages.get());
        metrics.put("ephemeral_fallbacks", ephemeralFallbacks.get());
        metrics.put("sessions_superseded", sessionsSuperseded.get());
    }
}
