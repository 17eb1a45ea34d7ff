package com.relationsim.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Full persistable state of one relationship. This is the versioned save document.
 *
 * <p>Subsystem state is the source of truth; {@link PersonalityState} and
 * {@link ResponseModifiers} are re-derived after a restore.
 */
public record RelationshipSnapshot(
    @JsonProperty("version")               String                           version,
    @JsonProperty("timestamp")             Instant                          timestamp,
    @JsonProperty("trust_score")           double                           trustScore,
    @JsonProperty("resentment_score")      double                           resentmentScore,
    @JsonProperty("emotional_safety")      double                           emotionalSafety,
    @JsonProperty("parenting_unity")       double                           parentingUnity,
    @JsonProperty("patterns")              List<BehaviorPattern>            patterns,
    @JsonProperty("emotional_memories")    List<EmotionalMemory>            emotionalMemories,
    @JsonProperty("apology_effectiveness") Map<ActionType, ApologyRecord>   apologyEffectiveness,
    @JsonProperty("tracking")              TrackingState                    tracking
) {

    public static final String CURRENT_VERSION = "1.0";

    public static final double DEFAULT_TRUST            = 60.0;
    public static final double DEFAULT_RESENTMENT       = 10.0;
    public static final double DEFAULT_EMOTIONAL_SAFETY = 50.0;
    public static final double DEFAULT_PARENTING_UNITY  = 70.0;

    public RelationshipSnapshot {
        patterns             = patterns == null ? List.of() : List.copyOf(patterns);
        emotionalMemories    = emotionalMemories == null ? List.of() : List.copyOf(emotionalMemories);
        apologyEffectiveness = apologyEffectiveness == null ? Map.of() : Map.copyOf(apologyEffectiveness);
    }

    /** Documented safe starting state, used for new relationships and failed loads. */
    public static RelationshipSnapshot defaults(Instant at) {
        return new RelationshipSnapshot(CURRENT_VERSION, at,
            DEFAULT_TRUST, DEFAULT_RESENTMENT, DEFAULT_EMOTIONAL_SAFETY, DEFAULT_PARENTING_UNITY,
            List.of(), List.of(), Map.of(), TrackingState.empty());
    }
}
