package org.arenasync.arena.session;

/**
 * Classifies a connection from its handshake metadata.
 */
public interface IBotClassifier {

    /**
     * @return {@link TrustLevel#SUSPECTED_BOT} for automated clients, otherwise
     *         {@link TrustLevel#UNVERIFIED}; token verification may raise it later.
     */
    TrustLevel classify(Handshake handshake);
}
