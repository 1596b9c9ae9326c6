package org.arenasync.arena.persistence;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Time window of a periodic leaderboard. A periodic entry lives for one period after the
 * score that set it; a lower score never replaces it before then.
 */
public enum ScorePeriod {
    ALL_TIME("all", null),
    WEEK("week", Duration.ofDays(7)),
    DAY("day", Duration.ofDays(1));

    private final String key;
    private final Duration length;

    ScorePeriod(String key, Duration length) {
        this.key = key;
        this.length = length;
    }

    public String key() {
        return key;
    }

    /**
     * @return The window length, empty for {@link #ALL_TIME}.
     */
    public Optional<Duration> length() {
        return Optional.ofNullable(length);
    }

    /**
     * Accepts the short key ("all", "week", "day") or the constant name, case-insensitively.
     *
     * @throws IllegalArgumentException for any other value.
     */
    public static ScorePeriod parse(String raw) {
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ScorePeriod period : values()) {
            if (period.key.equals(normalized) || period.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return period;
            }
        }
        throw new IllegalArgumentException("Unknown score period '" + raw + "', expected all, week or day");
    }
}
