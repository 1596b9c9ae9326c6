package org.arenasync.arena.broadcast;

import org.arenasync.arena.api.SessionId;

/**
 * Receives delivery problems the broadcaster cannot resolve on its own.
 */
public interface IDeliveryListener {

    /**
     * The session's critical side channel overflowed; it must be drained.
     */
    void onSlowConsumer(SessionId sessionId);

    /**
     * The transport rejected a frame.
     */
    void onTransportFailure(SessionId sessionId, Exception cause);
}
