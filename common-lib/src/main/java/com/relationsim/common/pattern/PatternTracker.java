package com.relationsim.common.pattern;

import com.relationsim.common.math.ScoreMath;
import com.relationsim.common.model.BehaviorPattern;
import com.relationsim.common.model.PatternType;
import com.relationsim.common.model.PlayerAction;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Detects recurring behavior inside a sliding window and keeps a decaying weight
 * per pattern.
 *
 * <h3>Lifecycle of a pattern</h3>
 * <ol>
 *   <li>Forms when {@value #MIN_OCCURRENCES} actions with the same signature fall inside
 *       the window ending at the latest of them. Weight starts at 1.0.</li>
 *   <li>Every recurrence refreshes the weight to 1.0 and resets the opposing-action counter.</li>
 *   <li>Without recurrence the weight decays 10% per elapsed day, computed lazily from
 *       {@code now − anchor}. Once it rounds to 0.00 the pattern is dropped.</li>
 *   <li>A negative pattern is broken by {@value #BREAK_THRESHOLD} consecutive positive actions:
 *       its weight resets to 0 and only occurrences after the break count toward re-forming it.</li>
 * </ol>
 *
 * <p>Fewer than {@value #MIN_OCCURRENCES} matching actions yields no pattern. An empty window and
 * an empty pattern set both return an empty list; callers fall back to single-action rules.
 *
 * <p>Not thread-safe. Mutation is serialized by the owning state manager.
 */
public class PatternTracker {

    public static final Duration DEFAULT_WINDOW  = Duration.ofDays(7);
    public static final int      MIN_OCCURRENCES = 3;
    public static final int      BREAK_THRESHOLD = 5;
    public static final double   DAILY_DECAY     = 0.10;

    /** Weights below this round to 0.00 and count as fully decayed. */
    private static final double FULLY_DECAYED = 0.005;
    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final Clock    clock;
    private final Duration window;
    private final int      minOccurrences;
    private final int      breakThreshold;

    private final List<PlayerAction>                history  = new ArrayList<>();
    private final Map<PatternType, PatternState>    states   = new EnumMap<>(PatternType.class);
    private final Map<PatternType, Instant>         brokenAt = new EnumMap<>(PatternType.class);
    private int positiveStreak;

    public PatternTracker(Clock clock) {
        this(clock, DEFAULT_WINDOW, MIN_OCCURRENCES, BREAK_THRESHOLD);
    }

    public PatternTracker(Clock clock, Duration window, int minOccurrences, int breakThreshold) {
        this.clock          = clock;
        this.window         = window;
        this.minOccurrences = minOccurrences;
        this.breakThreshold = breakThreshold;
    }

    // ── recording ───────────────────────────────────────────────────────────

    /**
     * Appends {@code action} to the timestamp-ordered history and updates pattern state.
     * In-order appends are O(1) amortized; a late action is inserted at its sorted position.
     */
    public void recordAction(PlayerAction action) {
        insertOrdered(action);
        positiveStreak = action.isPositive() ? positiveStreak + 1 : 0;

        PatternType signature = action.actionType().signature();
        if (signature != null) {
            PatternState state = states.get(signature);
            if (state != null) {
                state.recur(action.timestamp());
            } else {
                List<PlayerAction> inWindow = occurrences(signature,
                    action.timestamp().minus(window), action.timestamp());
                if (inWindow.size() >= minOccurrences) {
                    states.put(signature, new PatternState(
                        inWindow.get(0).timestamp(), action.timestamp()));
                }
            }
        }

        for (Map.Entry<PatternType, PatternState> entry : new ArrayList<>(states.entrySet())) {
            PatternType type = entry.getKey();
            if (!type.isNegative() || type == signature) continue;
            PatternState state = entry.getValue();
            state.opposingStreak = action.isPositive() ? state.opposingStreak + 1 : 0;
            if (state.opposingStreak >= breakThreshold) {
                breakPattern(type, action.timestamp());
            }
        }
    }

    // ── detection ───────────────────────────────────────────────────────────

    public List<BehaviorPattern> detectPatterns() {
        return detectPatterns(window, clock.instant());
    }

    public List<BehaviorPattern> detectPatterns(Duration detectionWindow) {
        return detectPatterns(detectionWindow, clock.instant());
    }

    /**
     * Scans {@code [now − detectionWindow, now]} and emits a pattern for every signature
     * with at least {@value #MIN_OCCURRENCES} occurrences. Fully decayed patterns are
     * dropped as a side effect.
     */
    public List<BehaviorPattern> detectPatterns(Duration detectionWindow, Instant now) {
        expireDecayed(now);
        Instant cutoff = now.minus(detectionWindow);
        List<BehaviorPattern> detected = new ArrayList<>();
        for (PatternType type : PatternType.values()) {
            List<PlayerAction> matches = occurrences(type, cutoff, now);
            if (matches.size() < minOccurrences) continue;
            detected.add(new BehaviorPattern(
                type,
                matches,
                matches.size() / windowDays(detectionWindow),
                ScoreMath.round2(weightOrDecayFromLast(type, matches, now)),
                matches.get(0).timestamp(),
                matches.get(matches.size() - 1).timestamp()));
        }
        return detected;
    }

    /** Occurrences of {@code type} in the active window per day. */
    public double getPatternFrequency(PatternType type) {
        return getPatternFrequency(type, clock.instant());
    }

    public double getPatternFrequency(PatternType type, Instant now) {
        return occurrences(type, now.minus(window), now).size() / windowDays(window);
    }

    // ── weights ─────────────────────────────────────────────────────────────

    public double getPatternWeight(PatternType type) {
        return getPatternWeight(type, clock.instant());
    }

    /**
     * Current decayed weight: {@code anchor × 0.9^elapsedDays}, floored at 0.
     * Returns 0.0 for a type that never formed a pattern or was broken.
     */
    public double getPatternWeight(PatternType type, Instant now) {
        PatternState state = states.get(type);
        if (state == null) return 0.0;
        double weight = state.weightAt(now);
        return weight < FULLY_DECAYED ? 0.0 : ScoreMath.clampUnit(weight);
    }

    /**
     * Breaks a negative pattern once its consecutive opposing-action counter has reached
     * {@value #BREAK_THRESHOLD}: weight resets to 0 and prior occurrences stop counting.
     *
     * @return {@code true} if the pattern was broken by this call
     */
    public boolean breakPattern(PatternType type) {
        Instant at = history.isEmpty() ? clock.instant() : history.get(history.size() - 1).timestamp();
        return breakPattern(type, at);
    }

    private boolean breakPattern(PatternType type, Instant at) {
        PatternState state = states.get(type);
        if (state == null || !type.isNegative() || state.opposingStreak < breakThreshold) {
            return false;
        }
        states.remove(type);
        brokenAt.put(type, at);
        return true;
    }

    /** Consecutive opposing actions counted against {@code type} since its last recurrence. */
    public int getOpposingStreak(PatternType type) {
        PatternState state = states.get(type);
        return state == null ? 0 : state.opposingStreak;
    }

    /** Consecutive positive actions across all types. */
    public int positiveStreak() {
        return positiveStreak;
    }

    // ── full-state views ────────────────────────────────────────────────────

    /**
     * Every tracked pattern, including ones whose occurrences have left the window but
     * whose weight has not fully decayed yet. Read-only.
     */
    public List<BehaviorPattern> getAllPatterns(Instant now) {
        List<BehaviorPattern> all = new ArrayList<>();
        for (Map.Entry<PatternType, PatternState> entry : states.entrySet()) {
            PatternType  type  = entry.getKey();
            PatternState state = entry.getValue();
            if (state.weightAt(now) < FULLY_DECAYED) continue;
            List<PlayerAction> matches = occurrences(type, state.firstSeen, state.lastSeen);
            all.add(new BehaviorPattern(
                type,
                matches,
                ScoreMath.round2(getPatternFrequency(type, now)),
                ScoreMath.round2(getPatternWeight(type, now)),
                state.firstSeen,
                state.lastSeen));
        }
        return all;
    }

    public List<PlayerAction> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public Map<PatternType, Integer> getOpposingStreaks() {
        Map<PatternType, Integer> streaks = new EnumMap<>(PatternType.class);
        states.forEach((type, state) -> {
            if (state.opposingStreak > 0) streaks.put(type, state.opposingStreak);
        });
        return streaks;
    }

    public Map<PatternType, Instant> getBrokenAt() {
        return Collections.unmodifiableMap(brokenAt);
    }

    /**
     * Drops actions older than {@code before}. Pattern weights and first/last-seen stamps
     * are unaffected.
     *
     * @return number of actions removed
     */
    public int pruneHistory(Instant before) {
        int initial = history.size();
        history.removeIf(a -> a.timestamp().isBefore(before));
        return initial - history.size();
    }

    /**
     * Replaces all state with a restored session.
     *
     * @param savedHistory  action history; pattern occurrences missing from it are merged in
     * @param patterns      tracked patterns with the weight they had at {@code savedAt}
     * @param streaks       opposing-action counters per pattern
     * @param breaks        break instants per pattern
     * @param savedAt       instant the weights were captured
     */
    public void restore(List<PlayerAction> savedHistory,
                        List<BehaviorPattern> patterns,
                        Map<PatternType, Integer> streaks,
                        Map<PatternType, Instant> breaks,
                        Instant savedAt) {
        history.clear();
        states.clear();
        brokenAt.clear();
        positiveStreak = 0;

        List<PlayerAction> merged = new ArrayList<>(savedHistory);
        Set<PlayerAction>  seen   = new HashSet<>(savedHistory);
        for (BehaviorPattern pattern : patterns) {
            for (PlayerAction occurrence : pattern.occurrences()) {
                if (seen.add(occurrence)) merged.add(occurrence);
            }
        }
        merged.sort(Comparator.comparing(PlayerAction::timestamp));
        history.addAll(merged);
        for (int i = history.size() - 1; i >= 0 && history.get(i).isPositive(); i--) {
            positiveStreak++;
        }

        for (BehaviorPattern pattern : patterns) {
            PatternState state = new PatternState(pattern.firstSeen(), pattern.lastSeen());
            state.anchorWeight   = ScoreMath.clampUnit(pattern.weight());
            state.anchorTime     = savedAt;
            state.opposingStreak = streaks.getOrDefault(pattern.patternType(), 0);
            states.put(pattern.patternType(), state);
        }
        brokenAt.putAll(breaks);
    }

    // ── internals ───────────────────────────────────────────────────────────

    private void insertOrdered(PlayerAction action) {
        int idx = history.size();
        while (idx > 0 && history.get(idx - 1).timestamp().isAfter(action.timestamp())) {
            idx--;
        }
        history.add(idx, action);
    }

    /** Matching actions inside {@code [from, to]} that happened after the pattern's last break. */
    private List<PlayerAction> occurrences(PatternType type, Instant from, Instant to) {
        Instant broken = brokenAt.get(type);
        List<PlayerAction> matches = new ArrayList<>();
        for (PlayerAction action : history) {
            Instant ts = action.timestamp();
            if (ts.isBefore(from) || ts.isAfter(to)) continue;
            if (action.actionType().signature() != type) continue;
            if (broken != null && !ts.isAfter(broken)) continue;
            matches.add(action);
        }
        return matches;
    }

    private double weightOrDecayFromLast(PatternType type, List<PlayerAction> matches, Instant now) {
        if (states.containsKey(type)) {
            return getPatternWeight(type, now);
        }
        Instant last = matches.get(matches.size() - 1).timestamp();
        return Math.pow(1.0 - DAILY_DECAY, elapsedDays(last, now));
    }

    private void expireDecayed(Instant now) {
        Iterator<Map.Entry<PatternType, PatternState>> it = states.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue().weightAt(now) < FULLY_DECAYED) it.remove();
        }
    }

    private static double windowDays(Duration d) {
        return Math.max(1.0, d.toMillis() / MILLIS_PER_DAY);
    }

    private static double elapsedDays(Instant from, Instant to) {
        return Math.max(0.0, Duration.between(from, to).toMillis() / MILLIS_PER_DAY);
    }

    private static final class PatternState {
        final Instant firstSeen;
        Instant lastSeen;
        double  anchorWeight = 1.0;
        Instant anchorTime;
        int     opposingStreak;

        PatternState(Instant firstSeen, Instant lastSeen) {
            this.firstSeen  = firstSeen;
            this.lastSeen   = lastSeen;
            this.anchorTime = lastSeen;
        }

        void recur(Instant at) {
            if (at.isAfter(lastSeen))   lastSeen   = at;
            if (at.isAfter(anchorTime)) anchorTime = at;
            anchorWeight   = 1.0;
            opposingStreak = 0;
        }

        double weightAt(Instant now) {
            return anchorWeight * Math.pow(1.0 - DAILY_DECAY, elapsedDays(anchorTime, now));
        }
    }
}
