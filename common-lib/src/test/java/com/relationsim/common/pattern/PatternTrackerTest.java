package com.relationsim.common.pattern;

import com.relationsim.common.MutableClock;
import com.relationsim.common.model.ActionType;
import com.relationsim.common.model.BehaviorPattern;
import com.relationsim.common.model.ContextType;
import com.relationsim.common.model.PatternType;
import com.relationsim.common.model.PlayerAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link PatternTracker}: formation threshold, sliding window,
 * lazy decay, pattern breaking and restore.
 */
class PatternTrackerTest {

    private static final Instant T0 = Instant.parse("2025-03-01T09:00:00Z");

    private MutableClock   clock;
    private PatternTracker tracker;

    @BeforeEach
    void setUp() {
        clock   = new MutableClock(T0);
        tracker = new PatternTracker(clock);
    }

    private static PlayerAction action(ActionType type, double valence, Instant at) {
        return PlayerAction.of(type, ContextType.PRIVATE, valence, at);
    }

    private void recordControlTaking(int count, Duration spacing) {
        for (int i = 0; i < count; i++) {
            tracker.recordAction(action(ActionType.CONTROL_TAKING, -0.6, T0.plus(spacing.multipliedBy(i))));
        }
    }

    // ── detection ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("detectPatterns()")
    class Detection {

        @Test
        @DisplayName("no history → empty list")
        void emptyHistory() {
            assertTrue(tracker.detectPatterns().isEmpty());
        }

        @Test
        @DisplayName("two matching actions → no pattern")
        void belowThreshold() {
            recordControlTaking(2, Duration.ofHours(1));
            assertTrue(tracker.detectPatterns(PatternTracker.DEFAULT_WINDOW, T0.plus(Duration.ofHours(2))).isEmpty());
            assertEquals(0.0, tracker.getPatternWeight(PatternType.CONTROL_TAKING, T0.plus(Duration.ofHours(2))));
        }

        @Test
        @DisplayName("three matching actions inside 7 days → pattern with frequency 3/7 and weight 1.0")
        void threeOccurrencesFormPattern() {
            recordControlTaking(3, Duration.ofDays(1));
            Instant now = T0.plus(Duration.ofDays(2));

            List<BehaviorPattern> patterns = tracker.detectPatterns(PatternTracker.DEFAULT_WINDOW, now);

            assertEquals(1, patterns.size());
            BehaviorPattern p = patterns.get(0);
            assertEquals(PatternType.CONTROL_TAKING, p.patternType());
            assertEquals(3, p.occurrenceCount());
            assertTrue(p.frequency() >= 3.0 / 7.0 - 1e-9);
            assertEquals(1.0, p.weight(), 1e-9);
            assertEquals(T0, p.firstSeen());
            assertEquals(now, p.lastSeen());
        }

        @Test
        @DisplayName("occurrences spread beyond the window → no pattern")
        void spreadBeyondWindow() {
            recordControlTaking(3, Duration.ofDays(4));
            assertTrue(tracker.detectPatterns(PatternTracker.DEFAULT_WINDOW, T0.plus(Duration.ofDays(8))).isEmpty());
        }

        @Test
        @DisplayName("actions without a signature never form patterns")
        void unsignedActionsIgnored() {
            for (int i = 0; i < 5; i++) {
                tracker.recordAction(action(ActionType.INTIMACY_SHARED, 0.9, T0.plus(Duration.ofHours(i))));
            }
            assertTrue(tracker.detectPatterns(PatternTracker.DEFAULT_WINDOW, T0.plus(Duration.ofHours(5))).isEmpty());
        }

        @Test
        @DisplayName("frequency counts only the active window")
        void frequencyUsesWindow() {
            recordControlTaking(3, Duration.ofDays(3));
            assertEquals(3.0 / 7.0, tracker.getPatternFrequency(PatternType.CONTROL_TAKING, T0.plus(Duration.ofDays(6))), 1e-9);
            assertEquals(2.0 / 7.0, tracker.getPatternFrequency(PatternType.CONTROL_TAKING, T0.plus(Duration.ofDays(8))), 1e-9);
        }
    }

    // ── decay ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("getPatternWeight(): lazy decay")
    class Decay {

        @Test
        @DisplayName("one day without recurrence → weight ≤ 0.9 × previous")
        void oneDayDecay() {
            recordControlTaking(3, Duration.ofHours(1));
            Instant formed = T0.plus(Duration.ofHours(2));

            double w0 = tracker.getPatternWeight(PatternType.CONTROL_TAKING, formed);
            double w1 = tracker.getPatternWeight(PatternType.CONTROL_TAKING, formed.plus(Duration.ofDays(1)));
            double w2 = tracker.getPatternWeight(PatternType.CONTROL_TAKING, formed.plus(Duration.ofDays(2)));

            assertEquals(1.0, w0, 1e-9);
            assertTrue(w1 <= 0.9 * w0 + 1e-9);
            assertEquals(0.81, w2, 1e-9);
        }

        @Test
        @DisplayName("recurrence refreshes weight to 1.0")
        void recurrenceRefreshes() {
            recordControlTaking(3, Duration.ofHours(1));
            Instant later = T0.plus(Duration.ofDays(3));
            assertTrue(tracker.getPatternWeight(PatternType.CONTROL_TAKING, later) < 0.75);

            tracker.recordAction(action(ActionType.CONTROL_TAKING, -0.4, later));
            assertEquals(1.0, tracker.getPatternWeight(PatternType.CONTROL_TAKING, later), 1e-9);
        }

        @Test
        @DisplayName("weight is never negative and reaches 0 after long inactivity")
        void floorsAtZero() {
            recordControlTaking(3, Duration.ofHours(1));
            Instant muchLater = T0.plus(Duration.ofDays(120));
            assertEquals(0.0, tracker.getPatternWeight(PatternType.CONTROL_TAKING, muchLater));
            assertTrue(tracker.getAllPatterns(muchLater).isEmpty());
        }

        @Test
        @DisplayName("weight is unchanged by repeated reads at the same instant")
        void readsArePure() {
            recordControlTaking(3, Duration.ofHours(1));
            Instant at = T0.plus(Duration.ofDays(1));
            double first = tracker.getPatternWeight(PatternType.CONTROL_TAKING, at);
            assertEquals(first, tracker.getPatternWeight(PatternType.CONTROL_TAKING, at));
        }
    }

    // ── breaking ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("breakPattern(): opposing streaks")
    class Breaking {

        @Test
        @DisplayName("5 consecutive positive opposing actions → negative pattern broken")
        void fiveOpposingBreak() {
            recordControlTaking(3, Duration.ofHours(1));
            for (int i = 0; i < 5; i++) {
                tracker.recordAction(action(ActionType.SUPPORTIVE_AUTONOMY, 0.8, T0.plus(Duration.ofHours(3 + i))));
            }
            Instant now = T0.plus(Duration.ofHours(9));

            assertEquals(0.0, tracker.getPatternWeight(PatternType.CONTROL_TAKING, now));
            assertTrue(tracker.detectPatterns(PatternTracker.DEFAULT_WINDOW, now).stream()
                .noneMatch(p -> p.patternType() == PatternType.CONTROL_TAKING));
            assertTrue(tracker.getBrokenAt().containsKey(PatternType.CONTROL_TAKING));
        }

        @Test
        @DisplayName("after a break only new occurrences count toward re-forming")
        void reformNeedsFreshOccurrences() {
            recordControlTaking(3, Duration.ofHours(1));
            for (int i = 0; i < 5; i++) {
                tracker.recordAction(action(ActionType.SUPPORTIVE_AUTONOMY, 0.8, T0.plus(Duration.ofHours(3 + i))));
            }
            tracker.recordAction(action(ActionType.CONTROL_TAKING, -0.5, T0.plus(Duration.ofHours(10))));
            tracker.recordAction(action(ActionType.CONTROL_TAKING, -0.5, T0.plus(Duration.ofHours(11))));
            assertEquals(0.0, tracker.getPatternWeight(PatternType.CONTROL_TAKING, T0.plus(Duration.ofHours(11))));

            tracker.recordAction(action(ActionType.CONTROL_TAKING, -0.5, T0.plus(Duration.ofHours(12))));
            assertEquals(1.0, tracker.getPatternWeight(PatternType.CONTROL_TAKING, T0.plus(Duration.ofHours(12))), 1e-9);
        }

        @Test
        @DisplayName("a neutral action resets the opposing streak")
        void neutralResetsStreak() {
            recordControlTaking(3, Duration.ofHours(1));
            for (int i = 0; i < 4; i++) {
                tracker.recordAction(action(ActionType.SUPPORTIVE_AUTONOMY, 0.8, T0.plus(Duration.ofHours(3 + i))));
            }
            assertEquals(4, tracker.getOpposingStreak(PatternType.CONTROL_TAKING));

            tracker.recordAction(action(ActionType.PARENTING_PRESENT, 0.1, T0.plus(Duration.ofHours(8))));
            assertEquals(0, tracker.getOpposingStreak(PatternType.CONTROL_TAKING));
            assertFalse(tracker.breakPattern(PatternType.CONTROL_TAKING));
        }

        @Test
        @DisplayName("positive patterns cannot be broken")
        void positivePatternNotBreakable() {
            for (int i = 0; i < 3; i++) {
                tracker.recordAction(action(ActionType.SUPPORTIVE_AUTONOMY, 0.8, T0.plus(Duration.ofHours(i))));
            }
            assertFalse(tracker.breakPattern(PatternType.SUPPORTIVE_AUTONOMY));
            assertTrue(tracker.getPatternWeight(PatternType.SUPPORTIVE_AUTONOMY, T0.plus(Duration.ofHours(2))) > 0.0);
        }
    }

    // ── history ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("history and restore")
    class History {

        @Test
        @DisplayName("late action is inserted in timestamp order")
        void lateInsertKeepsOrder() {
            tracker.recordAction(action(ActionType.PARENTING_PRESENT, 0.5, T0.plus(Duration.ofHours(2))));
            tracker.recordAction(action(ActionType.PARENTING_PRESENT, 0.5, T0));
            List<PlayerAction> history = tracker.getHistory();
            assertEquals(T0, history.get(0).timestamp());
            assertEquals(T0.plus(Duration.ofHours(2)), history.get(1).timestamp());
        }

        @Test
        @DisplayName("pruneHistory drops older actions only")
        void pruneHistory() {
            recordControlTaking(3, Duration.ofDays(2));
            int removed = tracker.pruneHistory(T0.plus(Duration.ofDays(3)));
            assertEquals(2, removed);
            assertEquals(1, tracker.getHistory().size());
        }

        @Test
        @DisplayName("restore reproduces weights at the save instant and pattern count")
        void restoreRoundTrip() {
            recordControlTaking(3, Duration.ofHours(1));
            Instant savedAt = T0.plus(Duration.ofDays(1));
            List<BehaviorPattern> saved = tracker.getAllPatterns(savedAt);

            PatternTracker restored = new PatternTracker(clock);
            restored.restore(tracker.getHistory(), saved, tracker.getOpposingStreaks(), tracker.getBrokenAt(), savedAt);

            assertEquals(saved.size(), restored.getAllPatterns(savedAt).size());
            assertEquals(tracker.getPatternWeight(PatternType.CONTROL_TAKING, savedAt),
                restored.getPatternWeight(PatternType.CONTROL_TAKING, savedAt), 0.01);
            assertEquals(3, restored.getHistory().size());
        }

        @Test
        @DisplayName("restore merges pattern occurrences missing from the saved history")
        void restoreMergesOccurrences() {
            recordControlTaking(3, Duration.ofHours(1));
            Instant savedAt = T0.plus(Duration.ofHours(3));
            List<BehaviorPattern> saved = tracker.getAllPatterns(savedAt);

            PatternTracker restored = new PatternTracker(clock);
            restored.restore(List.of(), saved, Map.of(), Map.of(), savedAt);

            assertEquals(3, restored.getHistory().size());
        }

        @Test
        @DisplayName("restore of a long history with overlapping occurrences stays linear")
        void restoreLargeHistory() {
            recordControlTaking(20_000, Duration.ofSeconds(20));
            Instant savedAt = T0.plus(Duration.ofDays(5));
            List<BehaviorPattern> saved = tracker.getAllPatterns(savedAt);
            assertEquals(20_000, saved.get(0).occurrences().size());

            PatternTracker restored = new PatternTracker(clock);
            assertTimeout(Duration.ofSeconds(2), () ->
                restored.restore(tracker.getHistory(), saved, Map.of(), Map.of(), savedAt));

            assertEquals(20_000, restored.getHistory().size());
        }
    }
}
