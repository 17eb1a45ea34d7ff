package com.relationsim.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Engagement metrics that ramp back gradually after withdrawal ends.
 */
public record EngagementLevels(
    @JsonProperty("response_length") double responseLength,
    @JsonProperty("initiation")      double initiation,
    @JsonProperty("cooperation")     double cooperation
) {

    public static EngagementLevels full() {
        return new EngagementLevels(1.0, 1.0, 1.0);
    }
}
