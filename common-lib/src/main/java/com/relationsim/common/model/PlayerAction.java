package com.relationsim.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A single player behavior, immutable once recorded.
 *
 * <p>Produced by the scenario layer from a choice's impact tags, or by the dialogue-input
 * layer from a free-form message's extracted valence and category. Pattern occurrences hold
 * references to the same instances the tracker's history holds.
 *
 * @param actionType behavior signature
 * @param context    PUBLIC (in front of the child) or PRIVATE
 * @param valence    emotional direction of the action in [-1.0, 1.0]
 * @param timestamp  when the action happened
 * @param metadata   free-form tags, e.g. {@code apology_for}, {@code apology_type}
 */
public record PlayerAction(
    @JsonProperty("action_type") ActionType          actionType,
    @JsonProperty("context")     ContextType         context,
    @JsonProperty("valence")     double              valence,
    @JsonProperty("timestamp")   Instant             timestamp,
    @JsonProperty("metadata")    Map<String, String> metadata
) {

    public static final String APOLOGY_FOR  = "apology_for";
    public static final String APOLOGY_TYPE = "apology_type";

    /** Valence above which an action counts as positive for streaks and runs. */
    public static final double POSITIVE_THRESHOLD = 0.3;

    public PlayerAction {
        Objects.requireNonNull(actionType, "actionType");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(timestamp, "timestamp");
        if (!Double.isFinite(valence) || valence < -1.0 || valence > 1.0) {
            throw new IllegalArgumentException("valence must be within [-1, 1] but was " + valence);
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static PlayerAction of(ActionType type, ContextType context, double valence, Instant at) {
        return new PlayerAction(type, context, valence, at, Map.of());
    }

    @JsonIgnore
    public boolean isPositive() {
        return valence > POSITIVE_THRESHOLD;
    }

    @JsonIgnore
    public boolean isNegative() {
        return valence < 0.0;
    }
}
