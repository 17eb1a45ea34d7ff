package com.relationsim.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How an interaction felt. Deliberately carries no dialogue text.
 */
public record EmotionalImpact(
    @JsonProperty("primary_emotion")  EmotionType     primaryEmotion,
    @JsonProperty("intensity")        double          intensity,
    @JsonProperty("valence")          double          valence,
    @JsonProperty("context_category") ContextCategory contextCategory
) {}
