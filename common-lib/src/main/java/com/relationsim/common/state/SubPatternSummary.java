package com.relationsim.common.state;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Secondary behavior metrics over the active pattern window.
 *
 * @param conflictEngagements     CONFLICT_ENGAGE actions in the window
 * @param conflictAvoidances      CONFLICT_AVOID actions in the window
 * @param parentingConsistency    {@code 1 / (1 + variance)} of daily parenting presence, in (0, 1]
 * @param controlTakingFrequency  CONTROL_TAKING occurrences per day
 * @param autonomyFrequency       SUPPORTIVE_AUTONOMY occurrences per day
 * @param stressAcknowledgments   STRESS_ACKNOWLEDGED and EMPATHY_SHOWN actions in the window
 * @param stressDismissals        STRESS_DISMISSED and EMPATHY_LACKING actions in the window
 * @param initiationStreak        consecutive accepted AI-initiated contacts
 */
public record SubPatternSummary(
    @JsonProperty("conflict_engagements")     int    conflictEngagements,
    @JsonProperty("conflict_avoidances")      int    conflictAvoidances,
    @JsonProperty("parenting_consistency")    double parentingConsistency,
    @JsonProperty("control_taking_frequency") double controlTakingFrequency,
    @JsonProperty("autonomy_frequency")       double autonomyFrequency,
    @JsonProperty("stress_acknowledgments")   int    stressAcknowledgments,
    @JsonProperty("stress_dismissals")        int    stressDismissals,
    @JsonProperty("initiation_streak")        int    initiationStreak
) {}
