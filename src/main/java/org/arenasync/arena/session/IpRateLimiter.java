package org.arenasync.arena.session;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.arenasync.arena.utils.KeyedRateLimiter;

import java.time.Duration;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Limits how often one remote address may open sessions.
 * <p>
 * <strong>Configuration Options:</strong>
 * <ul>
 *   <li><b>periodMs</b>: sustained interval between handshakes (default: 1000)</li>
 *   <li><b>burst</b>: handshakes allowed in a burst (default: 5)</li>
 * </ul>
 */
public class IpRateLimiter {

    private final KeyedRateLimiter<String> limiter;

    public IpRateLimiter(Config options) {
        this(options, System::nanoTime);
    }

    public IpRateLimiter(Config options, LongSupplier nanoClock) {
        Config defaults = ConfigFactory.parseMap(Map.of(
            "periodMs", 1000,
            "burst", 5
        ));
        Config config = options.withFallback(defaults);
        this.limiter = new KeyedRateLimiter<>(Duration.ofMillis(config.getLong("periodMs")), config.getInt("burst"), nanoClock);
    }

    /**
     * Records a handshake from {@code remoteAddress}.
     *
     * @return true if the handshake must be refused.
     */
    public boolean shouldLimit(String remoteAddress) {
        return limiter.shouldLimit(remoteAddress == null ? "" : remoteAddress);
    }

    public int trackedAddresses() {
        return limiter.size();
    }
}
