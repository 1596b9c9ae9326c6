package org.arenasync.node.processes.http;

/**
 * Thrown when an operator endpoint is called without valid credentials; answered with 401.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(final String message) {
        super(message);
    }
}
