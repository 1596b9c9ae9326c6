package org.arenasync.arena.session;

import org.arenasync.arena.broadcast.IFrameSink;

/**
 * Connection metadata presented when a client opens a session.
 *
 * @param remoteAddress Client IP address, used for rate limiting.
 * @param userAgent     Client user agent, may be null.
 * @param token         Identity token, null or blank for an anonymous session.
 * @param requestedName Display name the client asks for, may be null.
 * @param teamId        Team to join, may be null.
 * @param sink          Transport end of the session.
 */
public record Handshake(
    String remoteAddress,
    String userAgent,
    String token,
    String requestedName,
    String teamId,
    IFrameSink sink
) {

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }
}
