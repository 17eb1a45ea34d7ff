package com.relationsim.common.model;

/**
 * Primary emotion recorded in an {@link EmotionalImpact}.
 */
public enum EmotionType {
    JOY,
    TRUST,
    LOVE,
    GRATITUDE,
    CONTENTMENT,
    CALM,
    HOPE,
    SADNESS,
    ANGER,
    FRUSTRATION,
    DISAPPOINTMENT,
    ANXIETY,
    RESENTMENT,
    HURT,
    LONELINESS,
    STRESS;

    public boolean isPositive() {
        return switch (this) {
            case JOY, TRUST, LOVE, GRATITUDE, CONTENTMENT, CALM, HOPE -> true;
            default -> false;
        };
    }
}
