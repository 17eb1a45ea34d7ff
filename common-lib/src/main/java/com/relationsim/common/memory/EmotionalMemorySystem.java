package com.relationsim.common.memory;

import com.relationsim.common.math.ScoreMath;
import com.relationsim.common.model.ContextCategory;
import com.relationsim.common.model.ContextType;
import com.relationsim.common.model.EmotionType;
import com.relationsim.common.model.EmotionalImpact;
import com.relationsim.common.model.EmotionalMemory;
import com.relationsim.common.model.PatternType;
import com.relationsim.common.model.PlayerAction;
import com.relationsim.common.model.PlayerFlag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Stores how each interaction felt and answers recency-weighted recall queries.
 *
 * <p>Only {@link EmotionalImpact} is kept, never the words exchanged. Weights follow the
 * {@link TemporalWeight} table and are recomputed from age on every query; the stored weight
 * is refreshed by {@link #applyTemporalDecay(Instant)}.
 *
 * <p>Capacity is bounded at {@value #MAX_MEMORIES}. On overflow the lowest-weight, then oldest,
 * entries are evicted. Entries weighing more than {@value #PROTECTED_WEIGHT} are never evicted,
 * so the store may temporarily exceed capacity when everything left is protected.
 *
 * <p>Not thread-safe. Mutation is serialized by the owning state manager.
 */
public class EmotionalMemorySystem {

    private static final Logger log = LoggerFactory.getLogger(EmotionalMemorySystem.class);

    public static final int    MAX_MEMORIES     = 1000;
    public static final double PROTECTED_WEIGHT = 0.8;

    private final Clock clock;
    private final int   capacity;

    private final List<EmotionalMemory>    memories = new ArrayList<>();
    private final Map<PlayerFlag, Instant> flags    = new EnumMap<>(PlayerFlag.class);

    public EmotionalMemorySystem(Clock clock) {
        this(clock, MAX_MEMORIES);
    }

    public EmotionalMemorySystem(Clock clock, int capacity) {
        this.clock    = clock;
        this.capacity = capacity;
    }

    // ── storage ─────────────────────────────────────────────────────────────

    /**
     * Stores the impact of {@code interaction} at full weight, then enforces capacity
     * relative to the interaction's timestamp.
     */
    public EmotionalMemory storeMemory(PlayerAction interaction,
                                       EmotionalImpact impact,
                                       Set<PatternType> associatedPatterns) {
        EmotionalMemory memory = new EmotionalMemory(
            impact, interaction.timestamp(), interaction.context(),
            TemporalWeight.FRESH, associatedPatterns);
        memories.add(memory);
        if (memories.size() > capacity) {
            enforceCapacity(interaction.timestamp());
        }
        return memory;
    }

    public void applyTemporalDecay() {
        applyTemporalDecay(clock.instant());
    }

    /** Records the table weight on every memory. Idempotent for a fixed {@code now}. */
    public void applyTemporalDecay(Instant now) {
        memories.replaceAll(m -> m.withWeight(TemporalWeight.at(m.timestamp(), now)));
    }

    private void enforceCapacity(Instant now) {
        applyTemporalDecay(now);
        int excess = memories.size() - capacity;

        List<EmotionalMemory> candidates = new ArrayList<>();
        for (EmotionalMemory m : memories) {
            if (m.weight() <= PROTECTED_WEIGHT) candidates.add(m);
        }
        candidates.sort(Comparator.comparingDouble(EmotionalMemory::weight)
            .thenComparing(EmotionalMemory::timestamp));

        int removed = 0;
        for (EmotionalMemory victim : candidates) {
            if (removed >= excess) break;
            memories.remove(victim);
            removed++;
        }

        if (removed > 0) {
            log.info("Memory capacity enforced. removed={} remaining={} capacity={}",
                removed, memories.size(), capacity);
        }
        if (memories.size() > capacity) {
            log.warn("Memory overflow: only protected entries remain. size={} capacity={} protectedWeight>{}",
                memories.size(), capacity, PROTECTED_WEIGHT);
        }
    }

    // ── recall ──────────────────────────────────────────────────────────────

    public List<EmotionalMemory> recallSimilar(ContextType context, int limit) {
        return recallSimilar(context, limit, clock.instant());
    }

    /** Memories stored in {@code context}, heaviest first, newest first on ties. */
    public List<EmotionalMemory> recallSimilar(ContextType context, int limit, Instant now) {
        return ranked(m -> m.context() == context, limit, now);
    }

    public List<EmotionalMemory> recallSimilar(ContextCategory category, int limit) {
        return recallSimilar(category, limit, clock.instant());
    }

    public List<EmotionalMemory> recallSimilar(ContextCategory category, int limit, Instant now) {
        return ranked(m -> m.emotionalImpact().contextCategory() == category, limit, now);
    }

    public double getEmotionalAssociation(ContextCategory category) {
        return getEmotionalAssociation(category, clock.instant());
    }

    /**
     * Temporal-weight weighted mean valence for {@code category}, or 0.0 with no memories.
     */
    public double getEmotionalAssociation(ContextCategory category, Instant now) {
        double weighted = 0.0;
        double total    = 0.0;
        for (EmotionalMemory m : memories) {
            if (m.emotionalImpact().contextCategory() != category) continue;
            double w = TemporalWeight.at(m.timestamp(), now);
            weighted += w * m.emotionalImpact().valence();
            total    += w;
        }
        if (total == 0.0) return 0.0;
        return ScoreMath.round2(ScoreMath.clampBias(weighted / total));
    }

    public List<EmotionalMemory> getRecentMemories(Duration within, int limit) {
        return getRecentMemories(within, limit, clock.instant());
    }

    /** Memories younger than {@code within}, newest first. */
    public List<EmotionalMemory> getRecentMemories(Duration within, int limit, Instant now) {
        Instant cutoff = now.minus(within);
        return memories.stream()
            .filter(m -> !m.timestamp().isBefore(cutoff))
            .sorted(Comparator.comparing(EmotionalMemory::timestamp).reversed())
            .limit(limit)
            .toList();
    }

    public List<EmotionalMemory> getMemoriesByPattern(PatternType pattern, int limit) {
        return ranked(m -> m.associatedPatterns().contains(pattern), limit, clock.instant());
    }

    public List<EmotionalMemory> getMemoriesByEmotion(EmotionType emotion, int limit) {
        return ranked(m -> m.emotionalImpact().primaryEmotion() == emotion, limit, clock.instant());
    }

    public double getAverageValence(ContextCategory category, int days) {
        return getAverageValence(category, days, clock.instant());
    }

    /** Unweighted mean valence for {@code category} over the last {@code days}; 0.0 if none. */
    public double getAverageValence(ContextCategory category, int days, Instant now) {
        Instant cutoff = now.minus(Duration.ofDays(days));
        return ScoreMath.round2(memories.stream()
            .filter(m -> m.emotionalImpact().contextCategory() == category)
            .filter(m -> !m.timestamp().isBefore(cutoff))
            .mapToDouble(m -> m.emotionalImpact().valence())
            .average()
            .orElse(0.0));
    }

    public List<EmotionType> getDominantEmotions(int limit) {
        return getDominantEmotions(limit, clock.instant());
    }

    /** Emotions ranked by summed {@code intensity × temporal weight}. */
    public List<EmotionType> getDominantEmotions(int limit, Instant now) {
        Map<EmotionType, Double> scores = new EnumMap<>(EmotionType.class);
        for (EmotionalMemory m : memories) {
            double score = m.emotionalImpact().intensity() * TemporalWeight.at(m.timestamp(), now);
            scores.merge(m.emotionalImpact().primaryEmotion(), score, Double::sum);
        }
        return scores.entrySet().stream()
            .filter(e -> e.getValue() > 0.0)
            .sorted(Map.Entry.<EmotionType, Double>comparingByValue().reversed())
            .limit(limit)
            .map(Map.Entry::getKey)
            .toList();
    }

    // ── maintenance ─────────────────────────────────────────────────────────

    public int clearOldMemories(int days) {
        return clearOldMemories(days, clock.instant());
    }

    /** Removes memories older than {@code days}. Returns the number removed. */
    public int clearOldMemories(int days, Instant now) {
        Instant cutoff = now.minus(Duration.ofDays(days));
        int before = memories.size();
        memories.removeIf(m -> m.timestamp().isBefore(cutoff));
        int removed = before - memories.size();
        if (removed > 0) {
            log.info("Old memories cleared. removed={} olderThanDays={}", removed, days);
        }
        return removed;
    }

    public MemoryStats getMemoryStats() {
        return getMemoryStats(clock.instant());
    }

    public MemoryStats getMemoryStats(Instant now) {
        if (memories.isEmpty()) {
            return new MemoryStats(0, Map.of(), 0.0, 0.0, 0, null, null);
        }
        Map<ContextCategory, Integer> byCategory = new EnumMap<>(ContextCategory.class);
        double valenceSum = 0.0;
        double weightSum  = 0.0;
        int    protectedCount = 0;
        Instant oldest = null;
        Instant newest = null;
        for (EmotionalMemory m : memories) {
            byCategory.merge(m.emotionalImpact().contextCategory(), 1, Integer::sum);
            double w = TemporalWeight.at(m.timestamp(), now);
            valenceSum += m.emotionalImpact().valence();
            weightSum  += w;
            if (w > PROTECTED_WEIGHT) protectedCount++;
            if (oldest == null || m.timestamp().isBefore(oldest)) oldest = m.timestamp();
            if (newest == null || m.timestamp().isAfter(newest))  newest = m.timestamp();
        }
        int n = memories.size();
        return new MemoryStats(n, byCategory,
            ScoreMath.round2(valenceSum / n), ScoreMath.round2(weightSum / n),
            protectedCount, oldest, newest);
    }

    // ── player flags ────────────────────────────────────────────────────────

    public void flagPlayer(PlayerFlag flag, Instant at) {
        if (flags.putIfAbsent(flag, at) == null) {
            log.info("Player flagged. flag={} at={}", flag, at);
        }
    }

    public boolean isFlagged(PlayerFlag flag) {
        return flags.containsKey(flag);
    }

    public Map<PlayerFlag, Instant> getFlags() {
        return Collections.unmodifiableMap(flags);
    }

    // ── snapshot support ────────────────────────────────────────────────────

    public List<EmotionalMemory> getAllMemories() {
        return Collections.unmodifiableList(memories);
    }

    public int size() {
        return memories.size();
    }

    public void restore(List<EmotionalMemory> saved, Map<PlayerFlag, Instant> savedFlags) {
        memories.clear();
        memories.addAll(saved);
        memories.sort(Comparator.comparing(EmotionalMemory::timestamp));
        flags.clear();
        flags.putAll(savedFlags);
    }

    private List<EmotionalMemory> ranked(Predicate<EmotionalMemory> filter, int limit, Instant now) {
        return memories.stream()
            .filter(filter)
            .map(m -> m.withWeight(TemporalWeight.at(m.timestamp(), now)))
            .sorted(Comparator.comparingDouble(EmotionalMemory::weight).reversed()
                .thenComparing(EmotionalMemory::timestamp, Comparator.reverseOrder()))
            .limit(limit)
            .toList();
    }
}
