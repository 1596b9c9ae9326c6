package org.arenasync.arena.protocol;

/**
 * A malformed inbound message. The message is dropped and the session penalized;
 * the session itself continues.
 */
public class ProtocolException extends Exception {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
