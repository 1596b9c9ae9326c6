package org.arenasync.arena.protocol;

/**
 * Codes carried by critical notice frames.
 */
public enum NoticeCode {
    SESSION_ACCEPTED(1),
    PROTOCOL_VIOLATION(2),
    IDLE_TIMEOUT(3),
    SLOW_CONSUMER(4),
    SERVER_SHUTDOWN(5),
    CHAT_RATE_LIMITED(6),
    CHAT_REJECTED(7),
    CLOSING(8);

    private final int code;

    NoticeCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static NoticeCode fromCode(int code) {
        for (NoticeCode notice : values()) {
            if (notice.code == code) {
                return notice;
            }
        }
        throw new IllegalArgumentException("Unknown notice code " + code);
    }
}
