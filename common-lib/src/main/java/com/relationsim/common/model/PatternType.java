package com.relationsim.common.model;

/**
 * Recurring behavior signatures detected by
 * {@link com.relationsim.common.pattern.PatternTracker}.
 *
 * <p>Negative patterns can be broken by a run of opposing (positive) actions;
 * positive patterns only fade through temporal decay.
 */
public enum PatternType {
    CONSISTENT_PRESENCE (false),
    SPORADIC_INVOLVEMENT(true),
    CONFLICT_ENGAGEMENT (false),
    REPEATED_AVOIDANCE  (true),
    CONTROL_TAKING      (true),
    SUPPORTIVE_AUTONOMY (false),
    EMPATHETIC_SUPPORT  (false),
    EMPATHY_DEFICIT     (true),
    PUBLIC_UNITY        (false),
    PUBLIC_UNDERMINING  (true),
    STRESS_DISMISSAL    (true);

    private final boolean negative;

    PatternType(boolean negative) {
        this.negative = negative;
    }

    public boolean isNegative() {
        return negative;
    }
}
