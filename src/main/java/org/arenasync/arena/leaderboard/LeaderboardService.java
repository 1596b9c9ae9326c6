package org.arenasync.arena.leaderboard;

import com.typesafe.config.Config;
import org.arenasync.arena.api.PlayerId;
import org.arenasync.arena.resources.AbstractResource;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Aggregates player scores into a ranked, immutable {@link LeaderboardSnapshot}.
 * <p>
 * Score changes are buffered as they are reported, applied in one batch per tick by
 * {@link #commitTick(long)}, and ranked lazily by {@link #publish()}. Readers always see
 * a complete published snapshot through a volatile reference.
 * <p>
 * Ranking is a total order: score descending, then the tick the score was reached
 * (earlier first), then player id. Recomputing an unchanged score set yields the same
 * ranking.
 */
public class LeaderboardService extends AbstractResource {

    private sealed interface Change permits ScoreChange, Removal {
    }

    private record ScoreChange(PlayerId playerId, String displayName, long score) implements Change {
    }

    private record Removal(PlayerId playerId) implements Change {
    }

    private record Standing(PlayerId playerId, String displayName, long score, long achievedTick) {
    }

    private static final Comparator<Standing> RANKING = Comparator
        .comparingLong(Standing::score).reversed()
        .thenComparingLong(Standing::achievedTick)
        .thenComparing(standing -> standing.playerId().value());

    private final Clock clock;
    private final ConcurrentLinkedQueue<Change> changes = new ConcurrentLinkedQueue<>();
    private final Map<PlayerId, Standing> standings = new HashMap<>();
    private boolean dirty;
    private volatile LeaderboardSnapshot published = LeaderboardSnapshot.EMPTY;
    private final AtomicLong commits = new AtomicLong();

    public LeaderboardService(String name, Config options) {
        this(name, options, Clock.systemUTC());
    }

    public LeaderboardService(String name, Config options, Clock clock) {
        super(name, options);
        this.clock = clock;
    }

    /**
     * Reports a player's current score. Safe to call from any thread; takes effect at
     * the next {@link #commitTick(long)}.
     */
    public void recordScore(PlayerId playerId, String displayName, long score) {
        changes.add(new ScoreChange(playerId, displayName, score));
    }

    /**
     * Withdraws a player from the ranking at the next commit.
     */
    public void remove(PlayerId playerId) {
        changes.add(new Removal(playerId));
    }

    /**
     * Applies all buffered changes as of {@code tick}.
     */
    public void commitTick(long tick) {
        Change change;
        synchronized (standings) {
            while ((change = changes.poll()) != null) {
                if (change instanceof ScoreChange score) {
                    Standing before = standings.get(score.playerId());
                    if (before == null || before.score() != score.score()) {
                        standings.put(score.playerId(), new Standing(score.playerId(), score.displayName(), score.score(), tick));
                        dirty = true;
                    } else if (!before.displayName().equals(score.displayName())) {
                        standings.put(score.playerId(), new Standing(score.playerId(), score.displayName(), before.score(), before.achievedTick()));
                        dirty = true;
                    }
                } else if (standings.remove(((Removal) change).playerId()) != null) {
                    dirty = true;
                }
            }
        }
        commits.incrementAndGet();
    }

    /**
     * Ranks the committed standings if they changed since the last publication.
     *
     * @return The current published snapshot, new or unchanged.
     */
    public LeaderboardSnapshot publish() {
        List<Standing> ranked;
        synchronized (standings) {
            if (!dirty) {
                return published;
            }
            ranked = new ArrayList<>(standings.values());
            dirty = false;
        }
        ranked.sort(RANKING);
        List<LeaderboardEntry> entries = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            Standing standing = ranked.get(i);
            entries.add(new LeaderboardEntry(standing.playerId(), standing.displayName(), standing.score(), i + 1));
        }
        LeaderboardSnapshot next = new LeaderboardSnapshot(published.version() + 1, clock.instant(), entries);
        published = next;
        return next;
    }

    public LeaderboardSnapshot snapshot() {
        return published;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("version", published.version());
        metrics.put("entries", published.entries().size());
        metrics.put("commits", commits.get());
    }
}
