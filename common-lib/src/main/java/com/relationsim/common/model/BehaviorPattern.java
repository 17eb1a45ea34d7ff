package com.relationsim.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * A recurring behavior detected inside the sliding window.
 *
 * @param patternType signature the occurrences share
 * @param occurrences actions that formed the pattern, oldest first
 * @param frequency   occurrences per day over the detection window
 * @param weight      decayed weight in [0.0, 1.0]
 * @param firstSeen   timestamp of the first occurrence
 * @param lastSeen    timestamp of the latest occurrence
 */
public record BehaviorPattern(
    @JsonProperty("pattern_type") PatternType        patternType,
    @JsonProperty("occurrences")  List<PlayerAction> occurrences,
    @JsonProperty("frequency")    double             frequency,
    @JsonProperty("weight")       double             weight,
    @JsonProperty("first_seen")   Instant            firstSeen,
    @JsonProperty("last_seen")    Instant            lastSeen
) {

    public BehaviorPattern {
        occurrences = occurrences == null ? List.of() : List.copyOf(occurrences);
    }

    public int occurrenceCount() {
        return occurrences.size();
    }
}
