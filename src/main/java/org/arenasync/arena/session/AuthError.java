package org.arenasync.arena.session;

/**
 * Handshake rejection codes, sent as the WebSocket close code.
 */
public enum AuthError {
    INVALID_TOKEN(4100),
    EXPIRED_TOKEN(4101),
    RATE_LIMITED(4102),
    BOT_REJECTED(4103),
    SERVER_FULL(4104);

    private final int code;

    AuthError(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
