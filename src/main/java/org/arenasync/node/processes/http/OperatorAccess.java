package org.arenasync.node.processes.http;

import com.typesafe.config.Config;
import io.javalin.http.Context;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Guards the operator endpoints (announcements, node stop, error reset, session
 * listing) with a shared bearer token. Without a configured token every operator
 * request is refused.
 * <p>
 * <strong>Configuration Options:</strong>
 * <ul>
 *   <li><b>operator.token</b>: the shared secret, usually from {@code ARENA_OPERATOR_TOKEN} (default: none)</li>
 * </ul>
 */
public final class OperatorAccess {

    private static final String BEARER = "Bearer ";

    private final byte[] token;

    public OperatorAccess(final String token) {
        this.token = token == null || token.isBlank() ? null : token.strip().getBytes(StandardCharsets.UTF_8);
    }

    public static OperatorAccess fromConfig(final Config options) {
        return new OperatorAccess(options.hasPath("operator.token") ? options.getString("operator.token") : null);
    }

    public boolean isEnabled() {
        return token != null;
    }

    /**
     * @throws UnauthorizedException if the request does not carry the operator token.
     */
    public void require(final Context ctx) {
        if (token == null) {
            throw new UnauthorizedException("Operator endpoints are disabled; no operator token is configured");
        }
        final String header = ctx.header("Authorization");
        if (header == null || !header.startsWith(BEARER)) {
            throw new UnauthorizedException("Missing bearer token");
        }
        final byte[] presented = header.substring(BEARER.length()).strip().getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(token, presented)) {
            throw new UnauthorizedException("Invalid operator token");
        }
    }
}
