package org.arenasync.arena.broadcast;

import org.arenasync.arena.protocol.EncodedFrame;

import java.util.ArrayDeque;
import java.util.Iterator;

/**
 * Bounded per-session outbound queue with an explicit drop policy.
 * <p>
 * The main queue never exceeds {@code capacity}. When it is full, the oldest
 * droppable (world) frame is evicted to make room. When it holds only critical
 * frames, a new critical frame goes to a side channel capped at
 * {@code overflowCapacity} and a new droppable frame is discarded. A critical frame
 * that finds the side channel full is refused with {@link Offer#SATURATED}: the
 * session cannot keep up and has to be drained.
 * <p>
 * Every accepted frame gets a sequence number; {@link #poll()} always returns the
 * lowest pending one, so delivery order equals enqueue order.
 * <p>
 * <strong>Thread Safety:</strong> all methods are synchronized.
 */
public class OutboundQueue {

    /**
     * Outcome of {@link #offer(EncodedFrame)}.
     */
    public enum Offer {
        /** Enqueued without loss. */
        ACCEPTED,
        /** Enqueued after evicting the oldest droppable frame. */
        EVICTED_OLDEST,
        /** The new droppable frame was discarded; the queue holds only critical frames. */
        DROPPED,
        /** The critical frame went to the side channel. */
        OVERFLOWED,
        /** The critical frame was refused; the side channel is full. */
        SATURATED
    }

    private record Entry(long sequence, EncodedFrame frame) {
    }

    private final int capacity;
    private final int overflowCapacity;
    private final ArrayDeque<Entry> main;
    private final ArrayDeque<Entry> overflow = new ArrayDeque<>();
    private long nextSequence;
    private long dropped;

    public OutboundQueue(int capacity, int overflowCapacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Queue capacity must be positive, got " + capacity);
        }
        if (overflowCapacity < 0) {
            throw new IllegalArgumentException("Overflow capacity cannot be negative, got " + overflowCapacity);
        }
        this.capacity = capacity;
        this.overflowCapacity = overflowCapacity;
        this.main = new ArrayDeque<>(capacity);
    }

    public synchronized Offer offer(EncodedFrame frame) {
        if (main.size() < capacity) {
            main.addLast(new Entry(nextSequence++, frame));
            return Offer.ACCEPTED;
        }
        if (evictOldestDroppable()) {
            main.addLast(new Entry(nextSequence++, frame));
            return Offer.EVICTED_OLDEST;
        }
        if (!frame.isCritical()) {
            dropped++;
            return Offer.DROPPED;
        }
        if (overflow.size() < overflowCapacity) {
            overflow.addLast(new Entry(nextSequence++, frame));
            return Offer.OVERFLOWED;
        }
        return Offer.SATURATED;
    }

    private boolean evictOldestDroppable() {
        Iterator<Entry> it = main.iterator();
        while (it.hasNext()) {
            if (!it.next().frame().isCritical()) {
                it.remove();
                dropped++;
                return true;
            }
        }
        return false;
    }

    /**
     * Removes and returns the pending frame with the lowest sequence number.
     *
     * @return The next frame, or null if nothing is pending.
     */
    public synchronized EncodedFrame poll() {
        Entry head = main.peekFirst();
        Entry side = overflow.peekFirst();
        if (head == null && side == null) {
            return null;
        }
        if (side == null || (head != null && head.sequence() < side.sequence())) {
            return main.pollFirst().frame();
        }
        return overflow.pollFirst().frame();
    }

    /**
     * Cancels every pending frame.
     *
     * @return The number of frames cancelled.
     */
    public synchronized int clear() {
        int cancelled = main.size() + overflow.size();
        main.clear();
        overflow.clear();
        return cancelled;
    }

    public synchronized int size() {
        return main.size() + overflow.size();
    }

    public synchronized int mainSize() {
        return main.size();
    }

    public synchronized int overflowSize() {
        return overflow.size();
    }

    public synchronized boolean isEmpty() {
        return main.isEmpty() && overflow.isEmpty();
    }

    public synchronized long droppedCount() {
        return dropped;
    }

    public int capacity() {
        return capacity;
    }

    public int overflowCapacity() {
        return overflowCapacity;
    }
}
