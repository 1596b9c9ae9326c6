package org.arenasync.arena.session;

/**
 * A handshake was refused. The session never leaves {@link SessionState#CONNECTING}.
 */
public class AuthException extends Exception {

    private final AuthError error;

    public AuthException(AuthError error, String message) {
        super(message);
        this.error = error;
    }

    public AuthError getError() {
        return error;
    }
}
