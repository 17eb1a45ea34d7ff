package com.relationsim.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response-shaping parameters handed to the dialogue generator.
 *
 * <ul>
 *   <li>{@code responseLengthMultiplier} – [0.3, 1.0]; shrinks as trust falls</li>
 *   <li>{@code initiationProbability} – [0.0, 1.0]; chance the AI parent opens contact</li>
 *   <li>{@code cooperationLevel} – [0.0, 1.0]; willingness to go along with requests</li>
 *   <li>{@code emotionalVulnerability} – [0.0, 1.0]; how openly feelings are shared</li>
 *   <li>{@code interpretationBias} – [-1.0, 1.0]; charitable (+) or suspicious (−) reading</li>
 * </ul>
 */
public record ResponseModifiers(
    @JsonProperty("response_length_multiplier") double responseLengthMultiplier,
    @JsonProperty("initiation_probability")     double initiationProbability,
    @JsonProperty("cooperation_level")          double cooperationLevel,
    @JsonProperty("emotional_vulnerability")    double emotionalVulnerability,
    @JsonProperty("interpretation_bias")        double interpretationBias
) {}
