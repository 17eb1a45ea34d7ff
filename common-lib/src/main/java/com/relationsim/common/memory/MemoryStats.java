package com.relationsim.common.memory;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.relationsim.common.model.ContextCategory;

import java.time.Instant;
import java.util.Map;

/**
 * Summary of the memory store at a point in time.
 * Timestamps are null when the store is empty.
 */
public record MemoryStats(
    @JsonProperty("total_memories")   int                           totalMemories,
    @JsonProperty("by_category")      Map<ContextCategory, Integer> byCategory,
    @JsonProperty("average_valence")  double                        averageValence,
    @JsonProperty("average_weight")   double                        averageWeight,
    @JsonProperty("protected_count")  int                           protectedCount,
    @JsonProperty("oldest")           Instant                       oldest,
    @JsonProperty("newest")           Instant                       newest
) {}
