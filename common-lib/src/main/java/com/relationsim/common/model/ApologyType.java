package com.relationsim.common.model;

/**
 * Apology styles and the multiplier each applies to stored effectiveness.
 */
public enum ApologyType {
    DEFENSIVE      (0.3),
    GENERIC        (0.5),
    GENUINE        (1.0),
    ACTION_ORIENTED(1.5);

    private final double multiplier;

    ApologyType(double multiplier) {
        this.multiplier = multiplier;
    }

    public double multiplier() {
        return multiplier;
    }

    /**
     * Lenient parse used for metadata tags; unknown or blank values map to {@link #GENERIC}.
     */
    public static ApologyType fromTag(String tag) {
        if (tag == null || tag.isBlank()) return GENERIC;
        try {
            return valueOf(tag.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException e) {
            return GENERIC;
        }
    }
}
