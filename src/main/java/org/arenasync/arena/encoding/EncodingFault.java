package org.arenasync.arena.encoding;

/**
 * A delta cannot be produced for a session because its baseline is missing, too old
 * or already evicted. Recovered inside {@link SnapshotEncoder} by sending a full
 * snapshot; it never leaves the encoder.
 */
class EncodingFault extends Exception {

    enum Kind {
        NO_BASELINE,
        BASELINE_TOO_OLD,
        BASELINE_EVICTED
    }

    private final Kind kind;

    EncodingFault(Kind kind, String message) {
        super(message, null, false, false);
        this.kind = kind;
    }

    Kind kind() {
        return kind;
    }
}
