package com.relationsim.common.model;

/**
 * Discrete player behaviors produced by the scenario and dialogue-input layers.
 *
 * <p>Each type carries the {@link ContextCategory} its memories are filed under
 * and, where the behavior can recur as a pattern, its {@link PatternType} signature.
 * Valence of the individual {@link PlayerAction} still decides the sign of its impact.
 */
public enum ActionType {
    PARENTING_PRESENT   (ContextCategory.PARENTING, PatternType.CONSISTENT_PRESENCE),
    PARENTING_ABSENT    (ContextCategory.PARENTING, PatternType.SPORADIC_INVOLVEMENT),
    CONFLICT_ENGAGE     (ContextCategory.CONFLICT,  PatternType.CONFLICT_ENGAGEMENT),
    CONFLICT_AVOID      (ContextCategory.CONFLICT,  PatternType.REPEATED_AVOIDANCE),
    CONTROL_TAKING      (ContextCategory.PARENTING, PatternType.CONTROL_TAKING),
    SUPPORTIVE_AUTONOMY (ContextCategory.SUPPORT,   PatternType.SUPPORTIVE_AUTONOMY),
    EMPATHY_SHOWN       (ContextCategory.SUPPORT,   PatternType.EMPATHETIC_SUPPORT),
    EMPATHY_LACKING     (ContextCategory.SUPPORT,   PatternType.EMPATHY_DEFICIT),
    PUBLIC_SUPPORT      (ContextCategory.PARENTING, PatternType.PUBLIC_UNITY),
    PUBLIC_CONTRADICTION(ContextCategory.PARENTING, PatternType.PUBLIC_UNDERMINING),
    PRIVATE_CORRECTION  (ContextCategory.PARENTING, null),
    STRESS_ACKNOWLEDGED (ContextCategory.SUPPORT,   null),
    STRESS_DISMISSED    (ContextCategory.SUPPORT,   PatternType.STRESS_DISMISSAL),
    APOLOGY             (ContextCategory.CONFLICT,  null),
    INITIATION_ACCEPTED (ContextCategory.INTIMACY,  null),
    INITIATION_REBUFFED (ContextCategory.INTIMACY,  null),
    INTIMACY_SHARED     (ContextCategory.INTIMACY,  null);

    private final ContextCategory category;
    private final PatternType     signature;

    ActionType(ContextCategory category, PatternType signature) {
        this.category  = category;
        this.signature = signature;
    }

    public ContextCategory category() {
        return category;
    }

    /** Pattern this action counts toward, or {@code null} when it never forms one. */
    public PatternType signature() {
        return signature;
    }
}
