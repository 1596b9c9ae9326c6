package org.arenasync.arena.engine;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * The authoritative world tick. Only the tick driver advances it; everyone else reads it
 * to stamp critical frames.
 */
public final class TickCounter implements LongSupplier {

    private final AtomicLong tick = new AtomicLong();

    @Override
    public long getAsLong() {
        return tick.get();
    }

    long advance() {
        return tick.incrementAndGet();
    }
}
