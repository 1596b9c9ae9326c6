package org.arenasync.arena.leaderboard;

import com.typesafe.config.ConfigFactory;
import org.arenasync.arena.api.IService;
import org.arenasync.arena.api.PlayerId;
import org.arenasync.arena.broadcast.Broadcaster;
import org.arenasync.arena.persistence.PersistenceGateway;
import org.arenasync.arena.persistence.PlayerRecord;
import org.arenasync.arena.persistence.WriteClass;
import org.arenasync.arena.protocol.EncodedFrame;
import org.arenasync.arena.protocol.FrameCodec;
import org.arenasync.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LeaderboardPublisherTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-07-01T00:00:00Z"), ZoneOffset.UTC);

    private LeaderboardService leaderboard;
    private Broadcaster broadcaster;
    private PersistenceGateway gateway;
    private LeaderboardPublisher publisher;

    @BeforeEach
    void setUp() {
        leaderboard = new LeaderboardService("leaderboard", ConfigFactory.empty(), clock);
        broadcaster = mock(Broadcaster.class);
        gateway = mock(PersistenceGateway.class);
        when(gateway.upsertPlayer(any(), any())).thenReturn(CompletableFuture.completedFuture(null));
        when(gateway.saveLeaderboard(any())).thenReturn(CompletableFuture.completedFuture(null));
        publisher = new LeaderboardPublisher("publisher", ConfigFactory.parseMap(Map.of("size", 2, "intervalMs", 10)),
            leaderboard, broadcaster, gateway, () -> 42L, clock);
    }

    private void score(String id, long score, long tick) {
        leaderboard.recordScore(new PlayerId(id), id, score);
        leaderboard.commitTick(tick);
    }

    @Test
    @DisplayName("A changed top list is broadcast as a critical leaderboard frame")
    void changedTop_isBroadcast() throws Exception {
        ArgumentCaptor<EncodedFrame> frame = ArgumentCaptor.forClass(EncodedFrame.class);
        score("ana", 10, 1);
        score("bob", 20, 1);
        score("cid", 5, 1);

        assertThat(publisher.publishOnce()).isTrue();

        verify(broadcaster).broadcastCritical(frame.capture());
        assertThat(frame.getValue().tick()).isEqualTo(42);
        assertThat(FrameCodec.decodeLeaderboard(frame.getValue().payload()))
            .extracting(LeaderboardEntry::displayName).containsExactly("bob", "ana");
    }

    @Test
    @DisplayName("Changes below the visible top are stored but not broadcast")
    void changeBelowTop_isNotBroadcast() {
        score("ana", 10, 1);
        score("bob", 20, 1);
        score("cid", 5, 1);
        publisher.publishOnce();

        score("cid", 6, 2);

        assertThat(publisher.publishOnce()).isFalse();
        verify(broadcaster, times(1)).broadcastCritical(any());
        verify(gateway, times(2)).saveLeaderboard(any());
        assertThat(publisher.publishOnce()).isFalse();
        verify(gateway, times(2)).saveLeaderboard(any());
    }

    @Test
    @DisplayName("Only new personal bests of durable players are checkpointed")
    void checkpoints_onlyNewBests() {
        ArgumentCaptor<PlayerRecord> records = ArgumentCaptor.forClass(PlayerRecord.class);
        score("ana", 10, 1);
        leaderboard.recordScore(PlayerId.ephemeral(), "Guest-1", 50);
        leaderboard.commitTick(1);
        publisher.publishOnce();

        score("bob", 1, 2);
        publisher.publishOnce();

        verify(gateway, times(2)).upsertPlayer(records.capture(), eq(WriteClass.NON_CRITICAL));
        assertThat(records.getAllValues()).extracting(record -> record.playerId().value()).containsExactly("ana", "bob");
    }

    @Test
    @DisplayName("The service publishes on its own cadence until stopped")
    void service_publishesPeriodically() {
        score("ana", 10, 1);

        publisher.start();
        try {
            await().atMost(Duration.ofSeconds(2)).until(() -> publisher.getMetrics().get("publications").longValue() == 1);
        } finally {
            publisher.stop();
        }

        assertThat(publisher.getCurrentState()).isEqualTo(IService.State.STOPPED);
        verify(broadcaster).broadcastCritical(any());
    }
}
