package org.arenasync.arena.broadcast;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.arenasync.arena.api.SessionId;
import org.arenasync.arena.encoding.SnapshotEncoder;
import org.arenasync.arena.encoding.WorldFrame;
import org.arenasync.arena.protocol.EncodedFrame;
import org.arenasync.arena.protocol.FrameCodec;
import org.arenasync.arena.resources.AbstractResource;
import org.arenasync.arena.world.EntitySnapshot;
import org.arenasync.arena.world.Region;
import org.arenasync.arena.world.WorldState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans world frames and critical frames out to every registered session.
 * <p>
 * Each session has its own {@link OutboundQueue}; a slow session never delays another.
 * Frames are encoded and enqueued on the calling thread (the tick thread for world
 * frames) and handed to the transport by a shared sender pool. Sinks write
 * asynchronously and a session has at most one write in flight, so per-session order
 * is preserved and a stalled socket holds no sender thread. A write that does not
 * complete within {@code sendTimeoutMs} marks the session as a slow consumer.
 * <p>
 * <strong>Configuration Options:</strong>
 * <ul>
 *   <li><b>queueCapacity</b>: per-session queue bound (default: 32)</li>
 *   <li><b>criticalOverflowCapacity</b>: side channel for critical frames (default: 64)</li>
 *   <li><b>senderThreads</b>: size of the pool that starts writes (default: 2)</li>
 *   <li><b>sendTimeoutMs</b>: how long one write may stay incomplete (default: 5000)</li>
 * </ul>
 */
public class Broadcaster extends AbstractResource {

    private static final Logger log = LoggerFactory.getLogger(Broadcaster.class);

    private final SnapshotEncoder encoder;
    private final int queueCapacity;
    private final int overflowCapacity;
    private final long sendTimeoutMs;
    private final ExecutorService senders;
    private final Map<SessionId, Channel> channels = new ConcurrentHashMap<>();
    private volatile IDeliveryListener listener;

    private final AtomicLong framesSent = new AtomicLong();
    private final AtomicLong framesDropped = new AtomicLong();
    private final AtomicLong criticalOverflows = new AtomicLong();
    private final AtomicLong slowConsumers = new AtomicLong();
    private final AtomicLong sendFailures = new AtomicLong();

    /**
     * Delivery state of one session.
     */
    private static final class Channel {
        final SessionId sessionId;
        final IFrameSink sink;
        final OutboundQueue queue;
        final AtomicBoolean scheduled = new AtomicBoolean();
        volatile Region region = Region.ALL;
        volatile boolean worldFrames;
        volatile boolean closed;
        volatile boolean inFlight;
        volatile long lastWorldTickSent = -1L;

        Channel(SessionId sessionId, IFrameSink sink, OutboundQueue queue) {
            this.sessionId = sessionId;
            this.sink = sink;
            this.queue = queue;
        }
    }

    public Broadcaster(String name, Config options, SnapshotEncoder encoder) {
        super(name, options);
        Config defaults = ConfigFactory.parseMap(Map.of(
            "queueCapacity", 32,
            "criticalOverflowCapacity", 64,
            "senderThreads", 2,
            "sendTimeoutMs", 5000
        ));
        Config config = options.withFallback(defaults);
        this.encoder = encoder;
        this.queueCapacity = config.getInt("queueCapacity");
        this.overflowCapacity = config.getInt("criticalOverflowCapacity");
        int senderThreads = config.getInt("senderThreads");
        this.sendTimeoutMs = config.getLong("sendTimeoutMs");
        if (queueCapacity <= 0 || senderThreads <= 0 || sendTimeoutMs <= 0) {
            throw new IllegalArgumentException("queueCapacity, senderThreads and sendTimeoutMs must be positive for resource '" + name + "'.");
        }
        this.senders = Executors.newFixedThreadPool(senderThreads, senderThreadFactory(name));
    }

    private static ThreadFactory senderThreadFactory(String name) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, name + "-sender-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public void setDeliveryListener(IDeliveryListener listener) {
        this.listener = listener;
    }

    /**
     * Registers a session channel. World frames start only after {@link #subscribe}.
     */
    public void register(SessionId sessionId, IFrameSink sink) {
        Channel previous = channels.putIfAbsent(sessionId, new Channel(sessionId, sink, new OutboundQueue(queueCapacity, overflowCapacity)));
        if (previous != null) {
            throw new IllegalStateException("Session " + sessionId + " is already registered");
        }
    }

    /**
     * Starts (or moves) the world view of a session.
     */
    public void subscribe(SessionId sessionId, Region region) {
        Channel channel = channels.get(sessionId);
        if (channel != null) {
            channel.region = region;
            channel.worldFrames = true;
        }
    }

    /**
     * Stops world frames to a session while keeping critical delivery open.
     */
    public void stopWorldFrames(SessionId sessionId) {
        Channel channel = channels.get(sessionId);
        if (channel != null) {
            channel.worldFrames = false;
        }
    }

    /**
     * Removes a session, cancelling its pending frames and its encoder state.
     *
     * @return The number of cancelled frames.
     */
    public int unregister(SessionId sessionId) {
        encoder.forget(sessionId);
        Channel channel = channels.remove(sessionId);
        if (channel == null) {
            return 0;
        }
        channel.closed = true;
        int cancelled = channel.queue.clear();
        if (cancelled > 0) {
            log.debug("Cancelled {} pending frames of closed session {}", cancelled, sessionId);
        }
        return cancelled;
    }

    /**
     * Records the tick's canonical state and enqueues one world frame per subscribed session.
     * Called by the tick driver only.
     *
     * @return The canonical state of the tick.
     */
    public WorldState publish(long tick, Collection<EntitySnapshot> entities) {
        WorldState current = encoder.recordTick(tick, entities);
        for (Channel channel : channels.values()) {
            if (!channel.worldFrames || channel.closed) {
                continue;
            }
            WorldFrame frame = encoder.encode(channel.sessionId, channel.region, current);
            enqueue(channel, FrameCodec.encodeWorld(frame));
        }
        return current;
    }

    /**
     * Enqueues a critical frame on every registered session.
     */
    public void broadcastCritical(EncodedFrame frame) {
        requireCritical(frame);
        for (Channel channel : channels.values()) {
            if (!channel.closed) {
                enqueue(channel, frame);
            }
        }
    }

    /**
     * Enqueues a critical frame on one session.
     *
     * @return false if the session is not registered.
     */
    public boolean sendCritical(SessionId sessionId, EncodedFrame frame) {
        requireCritical(frame);
        Channel channel = channels.get(sessionId);
        if (channel == null || channel.closed) {
            return false;
        }
        enqueue(channel, frame);
        return true;
    }

    private static void requireCritical(EncodedFrame frame) {
        if (!frame.isCritical()) {
            throw new IllegalArgumentException(frame.kind() + " frames are not critical");
        }
    }

    private void enqueue(Channel channel, EncodedFrame frame) {
        OutboundQueue.Offer offer = channel.queue.offer(frame);
        switch (offer) {
            case EVICTED_OLDEST, DROPPED -> framesDropped.incrementAndGet();
            case OVERFLOWED -> criticalOverflows.incrementAndGet();
            case SATURATED -> {
                slowConsumers.incrementAndGet();
                log.warn("Session {} cannot keep up, critical side channel of {} frames is full", channel.sessionId, overflowCapacity);
                recordError("SLOW_CONSUMER", "Critical overflow exceeded", "session=" + channel.sessionId);
                IDeliveryListener current = listener;
                if (current != null) {
                    current.onSlowConsumer(channel.sessionId);
                }
                return;
            }
            default -> {
            }
        }
        schedule(channel);
    }

    private void schedule(Channel channel) {
        if (channel.scheduled.compareAndSet(false, true)) {
            resume(channel);
        }
    }

    private void drain(Channel channel) {
        EncodedFrame frame = channel.closed ? null : channel.queue.poll();
        if (frame == null) {
            channel.scheduled.set(false);
            // A frame enqueued after the last poll but before the flag reset would otherwise wait.
            if (!channel.closed && !channel.queue.isEmpty() && channel.scheduled.compareAndSet(false, true)) {
                resume(channel);
            }
            return;
        }
        channel.inFlight = true;
        CompletableFuture<Void> sending;
        try {
            sending = channel.sink.send(frame);
        } catch (RuntimeException e) {
            sending = CompletableFuture.failedFuture(e);
        }
        sending.orTimeout(sendTimeoutMs, TimeUnit.MILLISECONDS)
            .whenComplete((ignored, error) -> completed(channel, frame, error));
    }

    private void completed(Channel channel, EncodedFrame frame, Throwable error) {
        channel.inFlight = false;
        if (error == null) {
            framesSent.incrementAndGet();
            if (!frame.isCritical()) {
                channel.lastWorldTickSent = frame.tick();
            }
            // Completion may run on a transport thread; the next send goes back to the pool.
            resume(channel);
            return;
        }
        if (channel.closed) {
            channel.scheduled.set(false);
            return;
        }
        channel.closed = true;
        channel.queue.clear();
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        IDeliveryListener current = listener;
        if (cause instanceof TimeoutException) {
            slowConsumers.incrementAndGet();
            log.warn("Session {} did not accept a {} frame within {} ms", channel.sessionId, frame.kind(), sendTimeoutMs);
            recordError("SLOW_CONSUMER", "Send timed out", "session=" + channel.sessionId);
            if (current != null) {
                current.onSlowConsumer(channel.sessionId);
            }
            return;
        }
        sendFailures.incrementAndGet();
        log.warn("Failed to send {} frame to session {}: {}", frame.kind(), channel.sessionId, cause.getMessage());
        log.debug("Send failure details:", cause);
        recordError("SEND_FAILED", "Transport rejected frame", "session=" + channel.sessionId);
        if (current != null) {
            current.onTransportFailure(channel.sessionId, cause instanceof Exception e ? e : new IOException(cause));
        }
    }

    private void resume(Channel channel) {
        try {
            senders.execute(() -> drain(channel));
        } catch (RejectedExecutionException e) {
            channel.scheduled.set(false);
            log.debug("Sender pool rejected delivery for session {}, broadcaster is shutting down", channel.sessionId);
        }
    }

    /**
     * Returns the tick of the last world frame handed to the transport, -1 if none.
     */
    public long lastWorldTickSent(SessionId sessionId) {
        Channel channel = channels.get(sessionId);
        return channel == null ? -1L : channel.lastWorldTickSent;
    }

    public int pendingFrames(SessionId sessionId) {
        Channel channel = channels.get(sessionId);
        return channel == null ? 0 : channel.queue.size() + (channel.inFlight ? 1 : 0);
    }

    public Optional<OutboundQueue> queue(SessionId sessionId) {
        return Optional.ofNullable(channels.get(sessionId)).map(channel -> channel.queue);
    }

    public int sessionCount() {
        return channels.size();
    }

    /**
     * Stops the sender pool, giving in-flight sends a short grace period.
     */
    public void shutdown() {
        senders.shutdown();
        try {
            if (!senders.awaitTermination(2, TimeUnit.SECONDS)) {
                senders.shutdownNow();
            }
        } catch (InterruptedException e) {
            senders.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("sessions", channels.size());
        metrics.put("frames_sent", framesSent.get());
        metrics.put("frames_dropped", framesDropped.get());
        metrics.put("critical_overflows", criticalOverflows.get());
        metrics.put("slow_consumers", slowConsumers.get());
        metrics.put("send_failures", sendFailures.get());
    }
}
