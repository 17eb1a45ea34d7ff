package com.relationsim.common.math;

import com.relationsim.common.exception.NumericInstabilityException;

/**
 * Range and rounding helpers shared by every subsystem.
 *
 * <p>Stored values are rounded to two decimals; scores live in [0, 100], weights and
 * probabilities in [0, 1], biases in [-1, 1].
 */
public final class ScoreMath {

    public static final double SCORE_MIN = 0.0;
    public static final double SCORE_MAX = 100.0;

    private ScoreMath() {}

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static double clampScore(double value) {
        return clamp(value, SCORE_MIN, SCORE_MAX);
    }

    public static double clampUnit(double value) {
        return clamp(value, 0.0, 1.0);
    }

    public static double clampBias(double value) {
        return clamp(value, -1.0, 1.0);
    }

    /** Clamp to [0, 100] and round for storage. */
    public static double storeScore(double value) {
        return round2(clampScore(value));
    }

    /**
     * Returns {@code value} unchanged, or throws when it is NaN or infinite.
     *
     * @param component subsystem name for the exception tag
     * @param field     name of the value being checked
     */
    public static double requireFinite(String component, String field, double value) {
        if (!Double.isFinite(value)) {
            throw new NumericInstabilityException(component, field + " is not finite: " + value);
        }
        return value;
    }
}
