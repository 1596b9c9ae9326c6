package org.arenasync.arena.session;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Flags connections whose user agent is missing or contains a known automation marker.
 * <p>
 * <strong>Configuration Options:</strong>
 * <ul>
 *   <li><b>markers</b>: case-insensitive substrings identifying bots</li>
 *   <li><b>missingIsBot</b>: treat an absent user agent as a bot (default: true)</li>
 * </ul>
 */
public class UserAgentBotClassifier implements IBotClassifier {

    private static final List<String> DEFAULT_MARKERS = List.of(
        "bot", "crawler", "spider", "headless", "curl", "wget", "python-requests", "go-http-client", "java/"
    );

    private final List<String> markers;
    private final boolean missingIsBot;

    public UserAgentBotClassifier(Config options) {
        Config defaults = ConfigFactory.parseMap(Map.of(
            "markers", DEFAULT_MARKERS,
            "missingIsBot", true
        ));
        Config config = options.withFallback(defaults);
        this.markers = config.getStringList("markers").stream()
            .map(marker -> marker.toLowerCase(Locale.ROOT))
            .toList();
        this.missingIsBot = config.getBoolean("missingIsBot");
    }

    @Override
    public TrustLevel classify(Handshake handshake) {
        String userAgent = handshake.userAgent();
        if (userAgent == null || userAgent.isBlank()) {
            return missingIsBot ? TrustLevel.SUSPECTED_BOT : TrustLevel.UNVERIFIED;
        }
        String normalized = userAgent.toLowerCase(Locale.ROOT);
        for (String marker : markers) {
            if (normalized.contains(marker)) {
                return TrustLevel.SUSPECTED_BOT;
            }
        }
        return TrustLevel.UNVERIFIED;
    }
}
