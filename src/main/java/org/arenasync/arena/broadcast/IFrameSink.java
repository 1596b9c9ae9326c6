package org.arenasync.arena.broadcast;

import org.arenasync.arena.protocol.EncodedFrame;

import java.util.concurrent.CompletableFuture;

/**
 * Transport end of one session's channel (a WebSocket in production, a recording
 * sink in tests). The broadcaster keeps at most one send in flight per session.
 */
public interface IFrameSink {

    /**
     * Starts writing a frame. Implementations must not block the calling thread.
     *
     * @param frame The frame to send.
     * @return A future completed once the transport has written the frame, or completed
     *         exceptionally if the write failed; the session is then closed.
     */
    CompletableFuture<Void> send(EncodedFrame frame);

    /**
     * Closes the transport.
     *
     * @param code   Numeric close code sent to the client.
     * @param reason Human-readable reason.
     */
    void close(int code, String reason);
}
