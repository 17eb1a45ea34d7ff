package com.relationsim.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Per-behavior apology effectiveness.
 *
 * @param effectiveness    stored effectiveness in [0.1, 1.0]
 * @param lastRecurrence   latest recurrence of the behavior after an apology, or null
 * @param lastApologyType  style of the latest apology, or null if none yet
 * @param lastApologyAt    when the latest apology was made, or null
 * @param recoveredThrough instant up to which weekly recovery has already been credited
 */
public record ApologyRecord(
    @JsonProperty("effectiveness")     double      effectiveness,
    @JsonProperty("last_recurrence")   Instant     lastRecurrence,
    @JsonProperty("last_apology_type") ApologyType lastApologyType,
    @JsonProperty("last_apology_at")   Instant     lastApologyAt,
    @JsonProperty("recovered_through") Instant     recoveredThrough
) {

    public static ApologyRecord initial() {
        return new ApologyRecord(1.0, null, null, null, null);
    }

    public ApologyRecord withApology(ApologyType type, Instant at) {
        return new ApologyRecord(effectiveness, lastRecurrence, type, at, recoveredThrough);
    }

    public ApologyRecord withRecurrence(double newEffectiveness, Instant at) {
        return new ApologyRecord(newEffectiveness, at, lastApologyType, lastApologyAt, at);
    }

    public ApologyRecord withRecovery(double newEffectiveness, Instant through) {
        return new ApologyRecord(newEffectiveness, lastRecurrence, lastApologyType, lastApologyAt, through);
    }
}
