package com.relationsim.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Bookkeeping needed to continue a session exactly where it stopped. Optional in the
 * persisted document: an absent block restores as {@link #empty()}. An absent
 * {@code withdrawn} flag is re-derived from trust on restore.
 */
public record TrackingState(
    @JsonProperty("action_history")         List<PlayerAction>        actionHistory,
    @JsonProperty("pattern_streaks")        Map<PatternType, Integer> patternStreaks,
    @JsonProperty("pattern_broken_at")      Map<PatternType, Instant> patternBrokenAt,
    @JsonProperty("player_flags")           Map<PlayerFlag, Instant>  playerFlags,
    @JsonProperty("positive_run_started")   Instant                   positiveRunStarted,
    @JsonProperty("last_resentment_decay")  Instant                   lastResentmentDecay,
    @JsonProperty("initiation_streak")      int                       initiationStreak,
    @JsonProperty("engagement")             EngagementLevels          engagement,
    @JsonProperty("recovering")             boolean                   recovering,
    @JsonProperty("last_processed")         Instant                   lastProcessed,
    @JsonProperty("withdrawn")              Boolean                   withdrawn
) {

    public TrackingState {
        actionHistory   = actionHistory == null ? List.of() : List.copyOf(actionHistory);
        patternStreaks  = patternStreaks == null ? Map.of() : Map.copyOf(patternStreaks);
        patternBrokenAt = patternBrokenAt == null ? Map.of() : Map.copyOf(patternBrokenAt);
        playerFlags     = playerFlags == null ? Map.of() : Map.copyOf(playerFlags);
        engagement      = engagement == null ? EngagementLevels.full() : engagement;
    }

    public static TrackingState empty() {
        return new TrackingState(List.of(), Map.of(), Map.of(), Map.of(),
            null, null, 0, EngagementLevels.full(), false, null, null);
    }
}
