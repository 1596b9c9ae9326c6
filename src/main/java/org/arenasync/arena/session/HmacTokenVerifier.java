package org.arenasync.arena.session;

import com.typesafe.config.Config;
import org.arenasync.arena.api.PlayerId;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Verifies tokens of the form {@code playerId.expiryEpochSeconds.signature}, where the
 * signature is the unpadded base64url HMAC-SHA256 of {@code playerId.expiryEpochSeconds}
 * under a shared secret.
 */
public class HmacTokenVerifier implements ITokenVerifier {

    private static final String ALGORITHM = "HmacSHA256";
    private static final Pattern PLAYER_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final SecretKeySpec key;
    private final Clock clock;

    public HmacTokenVerifier(Config options, Clock clock) {
        this(options.getString("secret"), clock);
    }

    public HmacTokenVerifier(String secret, Clock clock) {
        if (secret == null || secret.length() < 16) {
            throw new IllegalArgumentException("Token secret must be at least 16 characters");
        }
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
        this.clock = clock;
    }

    @Override
    public PlayerId verify(String token) throws AuthException {
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3 || !PLAYER_ID.matcher(parts[0]).matches()) {
            throw new AuthException(AuthError.INVALID_TOKEN, "Malformed token");
        }
        long expiry;
        try {
            expiry = Long.parseLong(parts[1]);
        } catch (NumberFormatException e) {
            throw new AuthException(AuthError.INVALID_TOKEN, "Malformed token expiry");
        }
        byte[] presented;
        try {
            presented = Base64.getUrlDecoder().decode(parts[2]);
        } catch (IllegalArgumentException e) {
            throw new AuthException(AuthError.INVALID_TOKEN, "Malformed token signature");
        }
        if (!MessageDigest.isEqual(presented, sign(parts[0] + "." + parts[1]))) {
            throw new AuthException(AuthError.INVALID_TOKEN, "Token signature mismatch");
        }
        if (clock.instant().getEpochSecond() >= expiry) {
            throw new AuthException(AuthError.EXPIRED_TOKEN, "Token expired at " + Instant.ofEpochSecond(expiry));
        }
        PlayerId playerId = new PlayerId(parts[0]);
        if (playerId.isEphemeral()) {
            throw new AuthException(AuthError.INVALID_TOKEN, "Token names a reserved identity");
        }
        return playerId;
    }

    /**
     * Issues a token for {@code playerId} valid until {@code expiry}.
     *
     * @throws IllegalArgumentException if the id cannot be carried in a token or is reserved.
     */
    public String issue(PlayerId playerId, Instant expiry) {
        if (!PLAYER_ID.matcher(playerId.value()).matches() || playerId.isEphemeral()) {
            throw new IllegalArgumentException("Player id '" + playerId + "' cannot be issued a token");
        }
        String payload = playerId.value() + "." + expiry.getEpochSecond();
        return payload + "." + Base64.getUrlEncoder().withoutPadding().encodeToString(sign(payload));
    }

    private byte[] sign(String payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        }
    }
}
