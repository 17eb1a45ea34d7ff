package com.relationsim.common.memory;

import com.relationsim.common.MutableClock;
import com.relationsim.common.model.ActionType;
import com.relationsim.common.model.ContextCategory;
import com.relationsim.common.model.ContextType;
import com.relationsim.common.model.EmotionType;
import com.relationsim.common.model.EmotionalImpact;
import com.relationsim.common.model.EmotionalMemory;
import com.relationsim.common.model.PatternType;
import com.relationsim.common.model.PlayerAction;
import com.relationsim.common.model.PlayerFlag;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EmotionalMemorySystemTest {

    private static final Instant NOW = Instant.parse("2025-03-20T18:00:00Z");

    private MutableClock          clock;
    private EmotionalMemorySystem memory;

    @BeforeEach
    void setUp() {
        clock  = new MutableClock(NOW);
        memory = new EmotionalMemorySystem(clock);
    }

    private EmotionalMemory store(EmotionalMemorySystem target, ContextCategory category, ContextType context,
                                  EmotionType emotion, double valence, Instant at) {
        PlayerAction action = PlayerAction.of(ActionType.INTIMACY_SHARED, context, valence, at);
        EmotionalImpact impact = new EmotionalImpact(emotion, Math.abs(valence), valence, category);
        return target.storeMemory(action, impact, Set.of());
    }

    private EmotionalMemory store(ContextCategory category, double valence, Instant at) {
        return store(memory, category, ContextType.PRIVATE, valence >= 0 ? EmotionType.JOY : EmotionType.HURT,
            valence, at);
    }

    // ── temporal weight ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("TemporalWeight")
    class Weights {

        @Test
        @DisplayName("step table by age")
        void table() {
            assertEquals(1.0, TemporalWeight.forAge(Duration.ofHours(23)));
            assertEquals(0.8, TemporalWeight.forAge(Duration.ofDays(1)));
            assertEquals(0.8, TemporalWeight.forAge(Duration.ofDays(6)));
            assertEquals(0.5, TemporalWeight.forAge(Duration.ofDays(7)));
            assertEquals(0.5, TemporalWeight.forAge(Duration.ofDays(29)));
            assertEquals(0.3, TemporalWeight.forAge(Duration.ofDays(30)));
            assertEquals(0.3, TemporalWeight.forAge(Duration.ofDays(400)));
        }

        @Test
        @DisplayName("future timestamps count as fresh")
        void futureIsFresh() {
            assertEquals(1.0, TemporalWeight.at(NOW.plusSeconds(60), NOW));
        }
    }

    // ── recall ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("recall")
    class Recall {

        @Test
        @DisplayName("recallSimilar: heaviest first, newest first on equal weight")
        void ordering() {
            EmotionalMemory old     = store(ContextCategory.SUPPORT, 0.5, NOW.minus(Duration.ofDays(10)));
            EmotionalMemory recentA = store(ContextCategory.SUPPORT, 0.5, NOW.minus(Duration.ofDays(3)));
            EmotionalMemory recentB = store(ContextCategory.SUPPORT, 0.5, NOW.minus(Duration.ofDays(2)));
            EmotionalMemory fresh   = store(ContextCategory.SUPPORT, 0.5, NOW.minus(Duration.ofHours(1)));

            List<EmotionalMemory> recalled = memory.recallSimilar(ContextCategory.SUPPORT, 10, NOW);

            assertEquals(4, recalled.size());
            assertEquals(fresh.timestamp(),   recalled.get(0).timestamp());
            assertEquals(recentB.timestamp(), recalled.get(1).timestamp());
            assertEquals(recentA.timestamp(), recalled.get(2).timestamp());
            assertEquals(old.timestamp(),     recalled.get(3).timestamp());
            assertEquals(1.0, recalled.get(0).weight());
            assertEquals(0.5, recalled.get(3).weight());
        }

        @Test
        @DisplayName("recallSimilar by context type filters PUBLIC from PRIVATE and honors the limit")
        void byContextType() {
            store(memory, ContextCategory.PARENTING, ContextType.PUBLIC,  EmotionType.GRATITUDE, 0.6, NOW.minusSeconds(30));
            store(memory, ContextCategory.PARENTING, ContextType.PUBLIC,  EmotionType.GRATITUDE, 0.6, NOW.minusSeconds(20));
            store(memory, ContextCategory.PARENTING, ContextType.PRIVATE, EmotionType.GRATITUDE, 0.6, NOW.minusSeconds(10));

            List<EmotionalMemory> recalled = memory.recallSimilar(ContextType.PUBLIC, 1, NOW);

            assertEquals(1, recalled.size());
            assertEquals(ContextType.PUBLIC, recalled.get(0).context());
            assertEquals(NOW.minusSeconds(20), recalled.get(0).timestamp());
        }

        @Test
        @DisplayName("association: fresh +1.0 and 10-day-old -1.0 → 0.33")
        void weightedAssociation() {
            store(ContextCategory.CONFLICT, 1.0, NOW);
            store(ContextCategory.CONFLICT, -1.0, NOW.minus(Duration.ofDays(10)));

            assertEquals(0.33, memory.getEmotionalAssociation(ContextCategory.CONFLICT, NOW));
        }

        @Test
        @DisplayName("association without memories → 0.0")
        void emptyAssociation() {
            assertEquals(0.0, memory.getEmotionalAssociation(ContextCategory.INTIMACY, NOW));
        }

        @Test
        @DisplayName("recent memories: newest first, bounded by age")
        void recentMemories() {
            store(ContextCategory.SUPPORT, 0.4, NOW.minus(Duration.ofDays(5)));
            store(ContextCategory.SUPPORT, 0.4, NOW.minus(Duration.ofHours(5)));
            store(ContextCategory.SUPPORT, 0.4, NOW.minus(Duration.ofHours(1)));

            List<EmotionalMemory> recent = memory.getRecentMemories(Duration.ofDays(1), 10, NOW);

            assertEquals(2, recent.size());
            assertEquals(NOW.minus(Duration.ofHours(1)), recent.get(0).timestamp());
        }

        @Test
        @DisplayName("by pattern and by emotion")
        void byPatternAndEmotion() {
            PlayerAction avoid = PlayerAction.of(ActionType.CONFLICT_AVOID, ContextType.PRIVATE, -0.5, NOW);
            memory.storeMemory(avoid,
                new EmotionalImpact(EmotionType.DISAPPOINTMENT, 0.5, -0.5, ContextCategory.CONFLICT),
                Set.of(PatternType.REPEATED_AVOIDANCE));
            store(ContextCategory.SUPPORT, 0.5, NOW);

            clock.set(NOW);
            assertEquals(1, memory.getMemoriesByPattern(PatternType.REPEATED_AVOIDANCE, 10).size());
            assertEquals(1, memory.getMemoriesByEmotion(EmotionType.DISAPPOINTMENT, 10).size());
            assertTrue(memory.getMemoriesByEmotion(EmotionType.ANGER, 10).isEmpty());
        }

        @Test
        @DisplayName("average valence ignores memories outside the day range")
        void averageValence() {
            store(ContextCategory.PARENTING, 0.8, NOW.minus(Duration.ofDays(1)));
            store(ContextCategory.PARENTING, 0.2, NOW.minus(Duration.ofDays(2)));
            store(ContextCategory.PARENTING, -1.0, NOW.minus(Duration.ofDays(20)));

            assertEquals(0.5, memory.getAverageValence(ContextCategory.PARENTING, 7, NOW));
            assertEquals(0.0, memory.getAverageValence(ContextCategory.SUPPORT, 7, NOW));
        }

        @Test
        @DisplayName("dominant emotions ranked by intensity × weight")
        void dominantEmotions() {
            store(memory, ContextCategory.SUPPORT, ContextType.PRIVATE, EmotionType.HURT, -0.9, NOW.minus(Duration.ofDays(40)));
            store(memory, ContextCategory.SUPPORT, ContextType.PRIVATE, EmotionType.JOY,   0.5, NOW);

            List<EmotionType> dominant = memory.getDominantEmotions(2, NOW);

            assertEquals(List.of(EmotionType.JOY, EmotionType.HURT), dominant);
        }
    }

    // ── capacity and decay ──────────────────────────────────────────────────

    @Nested
    @DisplayName("capacity and decay")
    class Capacity {

        @Test
        @DisplayName("overflow evicts lowest weight first, then oldest")
        void evictsLowestWeight() {
            EmotionalMemorySystem small = new EmotionalMemorySystem(clock, 5);
            store(small, ContextCategory.SUPPORT, ContextType.PRIVATE, EmotionType.JOY, 0.5, NOW.minus(Duration.ofDays(3)));
            store(small, ContextCategory.SUPPORT, ContextType.PRIVATE, EmotionType.JOY, 0.5, NOW.minus(Duration.ofDays(40)));
            store(small, ContextCategory.SUPPORT, ContextType.PRIVATE, EmotionType.JOY, 0.5, NOW.minus(Duration.ofDays(10)));
            store(small, ContextCategory.SUPPORT, ContextType.PRIVATE, EmotionType.JOY, 0.5, NOW.minus(Duration.ofHours(2)));
            store(small, ContextCategory.SUPPORT, ContextType.PRIVATE, EmotionType.JOY, 0.5, NOW.minus(Duration.ofHours(1)));
            store(small, ContextCategory.SUPPORT, ContextType.PRIVATE, EmotionType.JOY, 0.5, NOW);

            assertEquals(5, small.size());
            assertTrue(small.getAllMemories().stream()
                .noneMatch(m -> m.timestamp().equals(NOW.minus(Duration.ofDays(40)))));
        }

        @Test
        @DisplayName("memories weighing above 0.8 are never evicted, even past capacity")
        void protectedSurvive() {
            EmotionalMemorySystem small = new EmotionalMemorySystem(clock, 3);
            for (int i = 0; i < 5; i++) {
                store(small, ContextCategory.SUPPORT, ContextType.PRIVATE, EmotionType.JOY, 0.5,
                    NOW.minus(Duration.ofMinutes(10 - i)));
            }
            assertEquals(5, small.size());
        }

        @Test
        @DisplayName("applyTemporalDecay is idempotent for a fixed instant")
        void idempotentDecay() {
            store(ContextCategory.SUPPORT, 0.5, NOW.minus(Duration.ofDays(2)));
            store(ContextCategory.SUPPORT, 0.5, NOW.minus(Duration.ofDays(12)));

            memory.applyTemporalDecay(NOW);
            List<EmotionalMemory> once = List.copyOf(memory.getAllMemories());
            memory.applyTemporalDecay(NOW);

            assertEquals(once, memory.getAllMemories());
            assertEquals(0.8, memory.getAllMemories().get(0).weight());
            assertEquals(0.5, memory.getAllMemories().get(1).weight());
        }

        @Test
        @DisplayName("clearOldMemories removes only entries past the cutoff")
        void clearOld() {
            store(ContextCategory.SUPPORT, 0.5, NOW.minus(Duration.ofDays(100)));
            store(ContextCategory.SUPPORT, 0.5, NOW.minus(Duration.ofDays(2)));

            assertEquals(1, memory.clearOldMemories(90, NOW));
            assertEquals(1, memory.size());
        }

        @Test
        @DisplayName("stats summarize counts, averages and bounds")
        void stats() {
            store(ContextCategory.SUPPORT,  1.0, NOW);
            store(ContextCategory.CONFLICT, -0.5, NOW.minus(Duration.ofDays(10)));

            MemoryStats stats = memory.getMemoryStats(NOW);

            assertEquals(2, stats.totalMemories());
            assertEquals(1, stats.byCategory().get(ContextCategory.SUPPORT));
            assertEquals(0.25, stats.averageValence());
            assertEquals(0.75, stats.averageWeight());
            assertEquals(1, stats.protectedCount());
            assertEquals(NOW.minus(Duration.ofDays(10)), stats.oldest());
            assertEquals(NOW, stats.newest());
        }

        @Test
        @DisplayName("stats on an empty store")
        void emptyStats() {
            MemoryStats stats = memory.getMemoryStats(NOW);
            assertEquals(0, stats.totalMemories());
            assertNull(stats.oldest());
        }
    }

    // ── flags ───────────────────────────────────────────────────────────────

    @Test
    @DisplayName("flagPlayer keeps the first flag instant")
    void flags() {
        assertFalse(memory.isFlagged(PlayerFlag.UNRELIABLE));
        memory.flagPlayer(PlayerFlag.UNRELIABLE, NOW);
        memory.flagPlayer(PlayerFlag.UNRELIABLE, NOW.plusSeconds(60));

        assertTrue(memory.isFlagged(PlayerFlag.UNRELIABLE));
        assertEquals(NOW, memory.getFlags().get(PlayerFlag.UNRELIABLE));
    }
}
