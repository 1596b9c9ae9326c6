package org.arenasync.arena.broadcast;

import org.arenasync.arena.protocol.EncodedFrame;
import org.arenasync.arena.protocol.FrameKind;
import org.arenasync.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class OutboundQueueTest {

    private static EncodedFrame world(long tick) {
        return new EncodedFrame(tick, FrameKind.DELTA, new byte[] {(byte) tick});
    }

    private static EncodedFrame chat(long tick) {
        return new EncodedFrame(tick, FrameKind.CHAT, new byte[] {(byte) tick});
    }

    private static List<EncodedFrame> drain(OutboundQueue queue) {
        List<EncodedFrame> frames = new ArrayList<>();
        EncodedFrame frame;
        while ((frame = queue.poll()) != null) {
            frames.add(frame);
        }
        return frames;
    }

    @Test
    @DisplayName("A full queue evicts its oldest world frame")
    void fullQueue_evictsOldestDroppable() {
        OutboundQueue queue = new OutboundQueue(3, 2);
        queue.offer(world(1));
        queue.offer(chat(2));
        queue.offer(world(3));

        assertEquals(OutboundQueue.Offer.EVICTED_OLDEST, queue.offer(world(4)));

        assertThat(drain(queue)).extracting(EncodedFrame::tick).containsExactly(2L, 3L, 4L);
        assertThat(queue.droppedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("A queue of critical frames drops new world frames and spills critical ones")
    void criticalOnlyQueue_usesSideChannel() {
        OutboundQueue queue = new OutboundQueue(2, 1);
        queue.offer(chat(1));
        queue.offer(chat(2));

        assertEquals(OutboundQueue.Offer.DROPPED, queue.offer(world(3)));
        assertEquals(OutboundQueue.Offer.OVERFLOWED, queue.offer(chat(4)));
        assertEquals(OutboundQueue.Offer.SATURATED, queue.offer(chat(5)));

        assertThat(queue.mainSize()).isEqualTo(2);
        assertThat(queue.overflowSize()).isEqualTo(1);
        assertThat(queue.size()).isLessThanOrEqualTo(queue.capacity() + queue.overflowCapacity());
    }

    @Test
    @DisplayName("Delivery order equals enqueue order across main queue and side channel")
    void poll_preservesEnqueueOrder() {
        OutboundQueue queue = new OutboundQueue(2, 4);
        queue.offer(chat(1));
        queue.offer(chat(2));
        queue.offer(chat(3));
        queue.poll();
        queue.offer(chat(4));
        queue.offer(chat(5));

        assertThat(drain(queue)).extracting(EncodedFrame::tick).containsExactly(2L, 3L, 4L, 5L);
    }

    @Test
    @DisplayName("Clear cancels every pending frame")
    void clear_cancelsAll() {
        OutboundQueue queue = new OutboundQueue(1, 1);
        queue.offer(chat(1));
        queue.offer(chat(2));

        assertThat(queue.clear()).isEqualTo(2);
        assertThat(queue.isEmpty()).isTrue();
        assertThat(queue.poll()).isNull();
    }

    @Test
    @DisplayName("Capacity must be positive")
    void rejectsInvalidCapacity() {
        assertThatThrownBy(() -> new OutboundQueue(0, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new OutboundQueue(1, -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
