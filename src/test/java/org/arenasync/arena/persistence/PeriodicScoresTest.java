package org.arenasync.arena.persistence;

import com.typesafe.config.ConfigFactory;
import org.arenasync.arena.api.PlayerId;
import org.arenasync.arena.api.StorageUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Player and team boards per period, through the in-memory store.
 */
@Tag("unit")
class PeriodicScoresTest {

    private static final Instant T0 = Instant.parse("2026-03-02T08:00:00Z");

    private InMemoryPlayerStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryPlayerStore("store", ConfigFactory.empty());
    }

    private void submit(String player, String team, long score, Instant at) throws StorageUnavailableException {
        store.recordScore(new ScoreSubmission(new PlayerId(player), player.toUpperCase(), team, score, at));
    }

    @Test
    @DisplayName("A lower score does not replace a live row but takes over once it expires")
    void lowerScore_waitsForExpiry() throws Exception {
        submit("ana", null, 500, T0);
        submit("ana", null, 300, T0.plus(Duration.ofHours(2)));

        assertThat(store.topScores(BoardScope.PLAYER, ScorePeriod.DAY, T0.plus(Duration.ofHours(3)), 10))
            .singleElement().extracting(PeriodicScore::score).isEqualTo(500L);

        submit("ana", null, 200, T0.plus(Duration.ofHours(25)));

        assertThat(store.topScores(BoardScope.PLAYER, ScorePeriod.DAY, T0.plus(Duration.ofHours(26)), 10))
            .singleElement().extracting(PeriodicScore::score).isEqualTo(200L);
        assertThat(store.topScores(BoardScope.PLAYER, ScorePeriod.WEEK, T0.plus(Duration.ofHours(26)), 10))
            .singleElement().extracting(PeriodicScore::score).isEqualTo(500L);
        assertThat(store.topScores(BoardScope.PLAYER, ScorePeriod.ALL_TIME, T0.plus(Duration.ofDays(30)), 10))
            .singleElement().extracting(PeriodicScore::score).isEqualTo(500L);
    }

    @Test
    @DisplayName("A higher score restarts the window")
    void higherScore_restartsWindow() throws Exception {
        submit("ana", null, 100, T0);
        submit("ana", null, 150, T0.plus(Duration.ofHours(20)));

        PeriodicScore row = store.topScores(BoardScope.PLAYER, ScorePeriod.DAY, T0.plus(Duration.ofHours(30)), 10).get(0);
        assertThat(row.score()).isEqualTo(150);
        assertThat(row.expiresAt()).isEqualTo(T0.plus(Duration.ofHours(44)));
    }

    @Test
    @DisplayName("Team rows hold the best score of any member and solo players stay off the team board")
    void teamBoard_keepsBestMember() throws Exception {
        submit("ana", "red", 300, T0);
        submit("bo", "red", 450, T0.plusSeconds(5));
        submit("cy", "blue", 400, T0.plusSeconds(10));
        submit("dee", null, 999, T0.plusSeconds(15));

        assertThat(store.topScores(BoardScope.TEAM, ScorePeriod.DAY, T0.plusSeconds(60), 10))
            .extracting(PeriodicScore::key, PeriodicScore::score)
            .containsExactly(tuple("red", 450L), tuple("blue", 400L));
    }

    @Test
    @DisplayName("Zero scores never reach a board and replaying a score changes nothing")
    void zeroAndReplayedScores() throws Exception {
        submit("ana", "red", 0, T0);
        assertThat(store.topScores(BoardScope.PLAYER, ScorePeriod.ALL_TIME, T0, 10)).isEmpty();

        submit("bo", null, 40, T0);
        PeriodicScore first = store.topScores(BoardScope.PLAYER, ScorePeriod.WEEK, T0, 10).get(0);
        submit("bo", null, 40, T0);

        assertThat(store.topScores(BoardScope.PLAYER, ScorePeriod.WEEK, T0, 10)).containsExactly(first);
    }

    @Test
    @DisplayName("Equal scores rank by who got there first")
    void ties_rankByAchievement() throws Exception {
        submit("late", null, 100, T0.plusSeconds(30));
        submit("early", null, 100, T0);

        assertThat(store.topScores(BoardScope.PLAYER, ScorePeriod.DAY, T0.plusSeconds(60), 1))
            .extracting(PeriodicScore::key).containsExactly("early");
    }

    @Test
    void periodAndScope_parse() {
        assertThat(ScorePeriod.parse("Week")).isEqualTo(ScorePeriod.WEEK);
        assertThat(ScorePeriod.parse("all_time")).isEqualTo(ScorePeriod.ALL_TIME);
        assertThat(BoardScope.parse(" team ")).isEqualTo(BoardScope.TEAM);
        assertThatThrownBy(() -> ScorePeriod.parse("month")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BoardScope.parse("guild")).isInstanceOf(IllegalArgumentException.class);
    }
}
