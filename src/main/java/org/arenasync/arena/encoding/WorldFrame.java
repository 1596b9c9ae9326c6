package org.arenasync.arena.encoding;

/**
 * World-sync payload produced for one session at one tick.
 */
public sealed interface WorldFrame permits FullSnapshot, DeltaFrame {

    /**
     * @return The tick whose state this frame describes.
     */
    long tick();
}
