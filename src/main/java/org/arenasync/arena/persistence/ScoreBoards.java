package org.arenasync.arena.persistence;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The six periodic boards (player and team, each all-time, week and day) as plain
 * maps. Not thread-safe; stores guard it with their own lock.
 */
final class ScoreBoards {

    /** Scores at or below this never reach a board. */
    private static final long MINIMUM_SCORE = 1L;

    private final Map<BoardScope, Map<ScorePeriod, Map<String, PeriodicScore>>> boards = new EnumMap<>(BoardScope.class);

    ScoreBoards() {
        for (BoardScope scope : BoardScope.values()) {
            Map<ScorePeriod, Map<String, PeriodicScore>> periods = new EnumMap<>(ScorePeriod.class);
            for (ScorePeriod period : ScorePeriod.values()) {
                periods.put(period, new HashMap<>());
            }
            boards.put(scope, periods);
        }
    }

    /**
     * Applies a submission to every board it belongs on.
     *
     * @return true if any row changed.
     */
    boolean record(ScoreSubmission submission) {
        if (submission.score() < MINIMUM_SCORE) {
            return false;
        }
        boolean changed = false;
        for (ScorePeriod period : ScorePeriod.values()) {
            changed |= offer(BoardScope.PLAYER, period, submission.playerId().value(), submission.displayName(), submission);
            if (submission.teamId() != null && !submission.teamId().isBlank()) {
                changed |= offer(BoardScope.TEAM, period, submission.teamId(), submission.teamId(), submission);
            }
        }
        return changed;
    }

    private boolean offer(BoardScope scope, ScorePeriod period, String key, String displayName, ScoreSubmission submission) {
        Map<String, PeriodicScore> rows = boards.get(scope).get(period);
        PeriodicScore current = rows.get(key);
        PeriodicScore next = current == null
            ? PeriodicScore.of(key, displayName, submission.score(), submission.achievedAt(), period)
            : current.offer(displayName, submission.score(), submission.achievedAt(), period);
        if (next == current) {
            return false;
        }
        rows.put(key, next);
        return true;
    }

    /**
     * Live rows of one board, best first. Expired rows are pruned on the way.
     */
    List<PeriodicScore> top(BoardScope scope, ScorePeriod period, Instant now, int limit) {
        Map<String, PeriodicScore> rows = boards.get(scope).get(period);
        rows.values().removeIf(row -> !row.isLiveAt(now));
        List<PeriodicScore> live = new ArrayList<>(rows.values());
        live.sort(PeriodicScore.BY_SCORE);
        return live.size() <= limit ? live : new ArrayList<>(live.subList(0, limit));
    }

    List<PeriodicScore> rows(BoardScope scope, ScorePeriod period) {
        return new ArrayList<>(boards.get(scope).get(period).values());
    }

    void restore(BoardScope scope, ScorePeriod period, List<PeriodicScore> rows) {
        Map<String, PeriodicScore> target = boards.get(scope).get(period);
        target.clear();
        for (PeriodicScore row : rows) {
            target.put(row.key(), row);
        }
    }

    int size() {
        int size = 0;
        for (Map<ScorePeriod, Map<String, PeriodicScore>> periods : boards.values()) {
            for (Map<String, PeriodicScore> rows : periods.values()) {
                size += rows.size();
            }
        }
        return size;
    }
}
