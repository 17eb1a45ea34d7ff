package com.relationsim.common.memory;

import java.time.Duration;
import java.time.Instant;

/**
 * Step-function recency weight for emotional memories.
 *
 * <pre>
 *   age &lt; 24h      → 1.0
 *   1 – 7 days     → 0.8
 *   7 – 30 days    → 0.5
 *   &gt; 30 days      → 0.3
 * </pre>
 *
 * Deterministic for a fixed {@code (stored, now)} pair, so applying it twice changes nothing.
 */
public final class TemporalWeight {

    public static final double FRESH    = 1.0;
    public static final double RECENT   = 0.8;
    public static final double FADING   = 0.5;
    public static final double DISTANT  = 0.3;

    private static final Duration ONE_DAY     = Duration.ofDays(1);
    private static final Duration ONE_WEEK    = Duration.ofDays(7);
    private static final Duration THIRTY_DAYS = Duration.ofDays(30);

    private TemporalWeight() {}

    public static double forAge(Duration age) {
        if (age.isNegative() || age.compareTo(ONE_DAY) < 0) return FRESH;
        if (age.compareTo(ONE_WEEK) < 0)                      return RECENT;
        if (age.compareTo(THIRTY_DAYS) < 0)                   return FADING;
        return DISTANT;
    }

    public static double at(Instant stored, Instant now) {
        return forAge(Duration.between(stored, now));
    }
}
