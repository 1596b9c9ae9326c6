package org.arenasync.arena.protocol;

/**
 * Kind of an outbound frame. World-sync kinds supersede each other and may be dropped
 * under backpressure; every other kind is critical and is never dropped.
 */
public enum FrameKind {
    FULL_SNAPSHOT(0, false),
    DELTA(1, false),
    LEADERBOARD(2, true),
    CHAT(3, true),
    NOTICE(4, true);

    private final int code;
    private final boolean critical;

    FrameKind(int code, boolean critical) {
        this.code = code;
        this.critical = critical;
    }

    public int code() {
        return code;
    }

    public boolean isCritical() {
        return critical;
    }

    public static FrameKind fromCode(int code) {
        for (FrameKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown frame kind code " + code);
    }
}
