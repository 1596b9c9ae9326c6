package org.arenasync.arena.session;

import org.arenasync.arena.api.PlayerId;

/**
 * Verifies identity tokens presented at handshake.
 */
public interface ITokenVerifier {

    /**
     * @param token A non-blank token.
     * @return The player the token identifies.
     * @throws AuthException with {@link AuthError#INVALID_TOKEN} or {@link AuthError#EXPIRED_TOKEN}.
     */
    PlayerId verify(String token) throws AuthException;
}
