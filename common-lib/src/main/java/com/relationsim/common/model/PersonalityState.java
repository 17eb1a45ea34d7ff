package com.relationsim.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Consolidated view of the relationship after the latest action. Derived on every
 * action and never persisted as the source of truth; read-only for the dialogue layer
 * until the next action is processed.
 */
public record PersonalityState(
    @JsonProperty("trust_score")          double             trustScore,
    @JsonProperty("resentment_score")     double             resentmentScore,
    @JsonProperty("emotional_safety")     double             emotionalSafety,
    @JsonProperty("parenting_unity")      double             parentingUnity,
    @JsonProperty("is_withdrawn")         boolean            withdrawn,
    @JsonProperty("withdrawal_severity")  WithdrawalSeverity withdrawalSeverity,
    @JsonProperty("recent_patterns")      List<PatternType>  recentPatterns,
    @JsonProperty("dominant_emotions")    List<EmotionType>  dominantEmotions
) {

    public PersonalityState {
        recentPatterns   = recentPatterns == null ? List.of() : List.copyOf(recentPatterns);
        dominantEmotions = dominantEmotions == null ? List.of() : List.copyOf(dominantEmotions);
    }
}
