package org.arenasync.arena.utils;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Per-key rate limiter allowing one action per {@code period} with bursts of up to
 * {@code burst} actions.
 * <p>
 * Each key keeps the time at which its allowance is fully restored. An action is
 * allowed if that time lies at most {@code (burst - 1) * period} in the future, and
 * every allowed action pushes it one period further. Keys whose allowance is fully
 * restored are pruned every 256 calls.
 * <p>
 * <strong>Thread Safety:</strong> all methods are synchronized.
 *
 * @param <K> The key type (an address, a session).
 */
public class KeyedRateLimiter<K> {

    private final long periodNanos;
    private final long burstNanos;
    private final LongSupplier nanoClock;
    private final Map<K, Long> restoredAt = new HashMap<>();
    private int pruneCounter;

    public KeyedRateLimiter(Duration period, int burst) {
        this(period, burst, System::nanoTime);
    }

    public KeyedRateLimiter(Duration period, int burst, LongSupplier nanoClock) {
        if (period.isNegative() || period.isZero()) {
            throw new IllegalArgumentException("Rate limit period must be positive, got " + period);
        }
        if (burst < 1) {
            throw new IllegalArgumentException("Burst must be at least 1, got " + burst);
        }
        this.periodNanos = period.toNanos();
        this.burstNanos = (burst - 1) * periodNanos;
        this.nanoClock = nanoClock;
    }

    /**
     * Records an action by {@code key}.
     *
     * @return true if the action must be blocked.
     */
    public synchronized boolean shouldLimit(K key) {
        long now = nanoClock.getAsLong();
        Long until = restoredAt.get(key);
        long base = until == null || until - now < 0 ? now : until;
        boolean limited = base - now > burstNanos;
        if (!limited) {
            restoredAt.put(key, base + periodNanos);
        }
        if (++pruneCounter == 256) {
            pruneCounter = 0;
            prune();
        }
        return limited;
    }

    /**
     * Drops keys whose allowance is fully restored.
     */
    public synchronized void prune() {
        long now = nanoClock.getAsLong();
        restoredAt.values().removeIf(until -> until - now <= 0);
    }

    public synchronized void forget(K key) {
        restoredAt.remove(key);
    }

    public synchronized int size() {
        return restoredAt.size();
    }
}
