package com.relationsim.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Set;

/**
 * Stored emotional impact of one interaction. {@code weight} is the last recorded
 * temporal weight; live queries recompute it from age.
 */
public record EmotionalMemory(
    @JsonProperty("emotional_impact")    EmotionalImpact  emotionalImpact,
    @JsonProperty("timestamp")           Instant          timestamp,
    @JsonProperty("context")             ContextType      context,
    @JsonProperty("weight")              double           weight,
    @JsonProperty("associated_patterns") Set<PatternType> associatedPatterns
) {

    public EmotionalMemory {
        associatedPatterns = associatedPatterns == null ? Set.of() : Set.copyOf(associatedPatterns);
    }

    public EmotionalMemory withWeight(double newWeight) {
        return new EmotionalMemory(emotionalImpact, timestamp, context, newWeight, associatedPatterns);
    }
}
