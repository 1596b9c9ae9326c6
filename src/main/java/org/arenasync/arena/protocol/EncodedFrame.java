package org.arenasync.arena.protocol;

/**
 * An outbound frame ready for the transport.
 *
 * @param tick    The tick the frame belongs to.
 * @param kind    The frame kind.
 * @param payload Complete wire bytes, header included.
 */
public record EncodedFrame(long tick, FrameKind kind, byte[] payload) {

    public boolean isCritical() {
        return kind.isCritical();
    }

    public int size() {
        return payload.length;
    }
}
