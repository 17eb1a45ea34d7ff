package com.relationsim.common.state;

import com.relationsim.common.exception.NumericInstabilityException;
import com.relationsim.common.math.ScoreMath;
import com.relationsim.common.memory.EmotionalMemorySystem;
import com.relationsim.common.model.ActionType;
import com.relationsim.common.model.ApologyType;
import com.relationsim.common.model.BehaviorPattern;
import com.relationsim.common.model.ContextType;
import com.relationsim.common.model.EngagementLevels;
import com.relationsim.common.model.PatternType;
import com.relationsim.common.model.PersonalityState;
import com.relationsim.common.model.PlayerAction;
import com.relationsim.common.model.PlayerFlag;
import com.relationsim.common.model.RelationshipSnapshot;
import com.relationsim.common.model.ResponseModifiers;
import com.relationsim.common.model.TrackingState;
import com.relationsim.common.model.WithdrawalSeverity;
import com.relationsim.common.pattern.PatternTracker;
import com.relationsim.common.trust.TrustDynamicsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Single writer for one relationship: routes every action through pattern tracking,
 * emotional memory and trust dynamics, then re-derives {@link PersonalityState} and
 * {@link ResponseModifiers}.
 *
 * <h3>Per-action pipeline</h3>
 * <ol>
 *   <li>Reject actions older than the last processed one.</li>
 *   <li>Credit resentment decay for the positive run so far, then extend or break the run.</li>
 *   <li>Record the action, prune history older than {@link #HISTORY_RETENTION} and detect
 *       patterns in the 7-day window.</li>
 *   <li>Store the emotional impact.</li>
 *   <li>Update emotional safety, parenting unity, trust and resentment.</li>
 *   <li>Re-derive state and modifiers; ramp engagement while recovering from withdrawal.</li>
 * </ol>
 *
 * <p>Derived state is cached after each action, so {@link #getCurrentState()} and
 * {@link #getResponseModifiers()} are pure reads. Not thread-safe on its own: callers
 * serialize writes, see the relationship coordinator.
 */
public class PersonalityStateManager {

    private static final Logger log = LoggerFactory.getLogger(PersonalityStateManager.class);

    static final String COMPONENT = "PersonalityStateManager";

    // ── emotional safety ────────────────────────────────────────────────────
    public static final double ACKNOWLEDGMENT_SAFETY_RATE = 3.0;
    public static final double DISMISSAL_SAFETY_RATE      = 1.0;
    public static final double SAFETY_RESILIENCE_THRESHOLD = 70.0;
    public static final double SAFETY_RESILIENCE_FACTOR    = 0.7;

    // ── parenting unity ─────────────────────────────────────────────────────
    public static final double UNITY_SUPPORT_RATE       = 2.0;
    public static final double UNITY_CONTRADICTION_RATE = 4.0;

    // ── conflict ────────────────────────────────────────────────────────────
    public static final double ENGAGEMENT_RESENTMENT_RELIEF = 1.0;
    public static final double AVOIDANCE_RESENTMENT_RELIEF  = 0.25;

    // ── initiation ──────────────────────────────────────────────────────────
    public static final int    INITIATION_STREAK_THRESHOLD = 3;
    public static final double INITIATION_STREAK_BONUS     = 0.15;
    public static final double MIN_INITIATION              = 0.1;

    // ── cooperation ─────────────────────────────────────────────────────────
    public static final double CONTROL_DAMPENING_RATE = 0.5;
    public static final double CONTROL_DAMPENING_CAP  = 0.6;

    private static final int    DOMINANT_EMOTION_LIMIT = 3;
    private static final int    CONSISTENCY_DAYS       = 7;
    private static final long   MILLIS_PER_DAY         = Duration.ofDays(1).toMillis();

    /** Actions older than this no longer feed detection or consistency and are pruned. */
    public static final Duration HISTORY_RETENTION =
        Duration.ofDays(Math.max(PatternTracker.DEFAULT_WINDOW.toDays(), CONSISTENCY_DAYS));

    private static final Set<ActionType> ACKNOWLEDGMENTS =
        EnumSet.of(ActionType.STRESS_ACKNOWLEDGED, ActionType.EMPATHY_SHOWN);
    private static final Set<ActionType> DISMISSALS =
        EnumSet.of(ActionType.STRESS_DISMISSED, ActionType.EMPATHY_LACKING);

    private final Clock                 clock;
    private final PatternTracker        patterns;
    private final EmotionalMemorySystem memory;
    private final TrustDynamicsEngine   trust;

    private double emotionalSafety = RelationshipSnapshot.DEFAULT_EMOTIONAL_SAFETY;
    private double parentingUnity  = RelationshipSnapshot.DEFAULT_PARENTING_UNITY;
    private int    initiationStreak;

    private EngagementLevels engagement = EngagementLevels.full();
    private boolean          recovering;
    private Instant          lastProcessed;

    private Set<PatternType> activePatterns = EnumSet.noneOf(PatternType.class);
    private long rejectedOutOfOrder;
    private long discardedUnstable;

    private PersonalityState  currentState;
    private ResponseModifiers currentModifiers;
    private RelationshipTone  currentTone;

    public PersonalityStateManager(Clock clock) {
        this(clock, new PatternTracker(clock), new EmotionalMemorySystem(clock), new TrustDynamicsEngine());
    }

    public PersonalityStateManager(Clock clock,
                                   PatternTracker patterns,
                                   EmotionalMemorySystem memory,
                                   TrustDynamicsEngine trust) {
        this.clock    = clock;
        this.patterns = patterns;
        this.memory   = memory;
        this.trust    = trust;
        derive(clock.instant(), false);
    }

    // ── processing ──────────────────────────────────────────────────────────

    /**
     * Applies one action.
     *
     * @return {@code false} if the action predates the last processed one and was rejected
     */
    public boolean processAction(PlayerAction action) {
        Instant at = action.timestamp();
        if (lastProcessed != null && at.isBefore(lastProcessed)) {
            rejectedOutOfOrder++;
            log.warn("Out-of-order action rejected. type={} at={} lastProcessed={} rejectedTotal={}",
                action.actionType(), at, lastProcessed, rejectedOutOfOrder);
            return false;
        }

        trust.applyResentmentDecay(at);
        trust.noteInteraction(action.isPositive(), at);

        patterns.recordAction(action);
        int pruned = patterns.pruneHistory(at.minus(HISTORY_RETENTION));
        if (pruned > 0) {
            log.debug("Action history pruned. removed={} retained={} before={}",
                pruned, patterns.getHistory().size(), at.minus(HISTORY_RETENTION));
        }
        List<BehaviorPattern> detected = patterns.detectPatterns(PatternTracker.DEFAULT_WINDOW, at);
        Set<PatternType> nowActive = EnumSet.noneOf(PatternType.class);
        detected.forEach(p -> nowActive.add(p.patternType()));
        logPatternTransitions(nowActive, at);
        activePatterns = nowActive;

        PatternType signature = action.actionType().signature();
        boolean isPattern = signature != null && nowActive.contains(signature);

        memory.storeMemory(action, ImpactAppraiser.appraise(action),
            isPattern ? Set.of(signature) : Set.of());

        boolean wasWithdrawn = trust.isInWithdrawal();
        try {
            applyScores(action, isPattern);
        } catch (NumericInstabilityException e) {
            discardedUnstable++;
            log.warn("Unstable update discarded, prior scores kept. type={} at={} reason={}",
                action.actionType(), at, e.getMessage());
        }
        trackWithdrawal(wasWithdrawn, at);

        lastProcessed = at;
        derive(at, true);

        log.debug("Action processed. type={} context={} valence={} trust={} resentment={} safety={} unity={}",
            action.actionType(), action.context(), action.valence(),
            trust.getTrustScore(), trust.getResentmentScore(), emotionalSafety, parentingUnity);
        return true;
    }

    /**
     * Applies a batch in timestamp order regardless of arrival order.
     *
     * @return number of actions accepted
     */
    public int processActions(List<PlayerAction> batch) {
        List<PlayerAction> ordered = new ArrayList<>(batch);
        ordered.sort(Comparator.comparing(PlayerAction::timestamp));
        int accepted = 0;
        for (PlayerAction action : ordered) {
            if (processAction(action)) accepted++;
        }
        return accepted;
    }

    private void applyScores(PlayerAction action, boolean isPattern) {
        ActionType type      = action.actionType();
        Instant    at        = action.timestamp();
        double     magnitude = Math.abs(action.valence());

        double safety = emotionalSafety;
        if (ACKNOWLEDGMENTS.contains(type)) {
            safety += ACKNOWLEDGMENT_SAFETY_RATE * magnitude;
        } else if (DISMISSALS.contains(type)) {
            safety -= DISMISSAL_SAFETY_RATE * magnitude;
        }

        double unity = parentingUnity;
        if (action.context() == ContextType.PUBLIC) {
            if (type == ActionType.PUBLIC_SUPPORT) {
                unity += UNITY_SUPPORT_RATE * magnitude;
            } else if (type == ActionType.PUBLIC_CONTRADICTION) {
                unity -= UNITY_CONTRADICTION_RATE * magnitude;
            }
        }

        double unit = action.valence();
        if (type == ActionType.APOLOGY) {
            unit = magnitude * recordApology(action);
        } else if (action.isNegative() && trust.hasApologyOnRecord(type)) {
            trust.recordBehaviorRecurrence(type, at);
        }
        if (unit < 0 && !DISMISSALS.contains(type) && emotionalSafety > SAFETY_RESILIENCE_THRESHOLD) {
            unit *= SAFETY_RESILIENCE_FACTOR;
        }
        if (unit > 0 && type == ActionType.PARENTING_PRESENT) {
            unit *= 0.5 + 0.5 * parentingConsistency(at);
        }

        ScoreMath.requireFinite(COMPONENT, "emotionalSafety", safety);
        ScoreMath.requireFinite(COMPONENT, "parentingUnity", unity);

        trust.updateTrust(unit, action.context(), type, at);
        emotionalSafety = ScoreMath.storeScore(safety);
        parentingUnity  = ScoreMath.storeScore(unity);

        switch (type) {
            case CONFLICT_ENGAGE -> trust.updateResentment(-ENGAGEMENT_RESENTMENT_RELIEF * magnitude, false, at);
            case CONFLICT_AVOID -> {
                if (isPattern) {
                    trust.updateResentment(magnitude, true, at);
                    memory.flagPlayer(PlayerFlag.UNRELIABLE, at);
                } else {
                    trust.updateResentment(-AVOIDANCE_RESENTMENT_RELIEF * magnitude, false, at);
                }
            }
            case INITIATION_ACCEPTED -> initiationStreak++;
            case INITIATION_REBUFFED -> initiationStreak = 0;
            default -> {
                if (action.isNegative()) {
                    trust.updateResentment(magnitude, isPattern, at);
                }
            }
        }
    }

    /** Records the apology and returns the effectiveness applied to its trust unit. */
    private double recordApology(PlayerAction action) {
        String behaviorTag = action.metadata().get(PlayerAction.APOLOGY_FOR);
        ApologyType style  = ApologyType.fromTag(action.metadata().get(PlayerAction.APOLOGY_TYPE));
        if (behaviorTag == null) {
            return style.multiplier();
        }
        try {
            ActionType behavior = ActionType.valueOf(behaviorTag.trim().toUpperCase());
            return trust.recordApology(behavior, style, action.timestamp());
        } catch (IllegalArgumentException e) {
            log.warn("Apology for unknown behavior treated as untracked. apologyFor={}", behaviorTag);
            return style.multiplier();
        }
    }

    private void trackWithdrawal(boolean wasWithdrawn, Instant at) {
        boolean withdrawn = trust.isInWithdrawal();
        if (wasWithdrawn && !withdrawn) {
            recovering = true;
            log.info("Withdrawal ended, engagement ramping up. trust={} at={}", trust.getTrustScore(), at);
        } else if (!wasWithdrawn && withdrawn) {
            recovering = false;
            log.info("Withdrawal entered. trust={} severity={} at={}",
                trust.getTrustScore(), trust.getWithdrawalSeverity(), at);
        }
    }

    private void logPatternTransitions(Set<PatternType> nowActive, Instant at) {
        for (PatternType type : nowActive) {
            if (!activePatterns.contains(type)) {
                log.info("Pattern detected. type={} frequency={} at={}",
                    type, ScoreMath.round2(patterns.getPatternFrequency(type, at)), at);
            }
        }
        for (PatternType type : activePatterns) {
            if (!nowActive.contains(type)) {
                log.info("Pattern no longer active. type={} at={}", type, at);
            }
        }
    }

    // ── derivation ──────────────────────────────────────────────────────────

    private void derive(Instant at, boolean advanceRamp) {
        double trustScore      = trust.getTrustScore();
        double resentmentScore = trust.getResentmentScore();
        WithdrawalSeverity severity = trust.getWithdrawalSeverity();

        RelationshipTone tone   = RelationshipTone.of(trustScore, resentmentScore);
        ModifierPreset   preset = ModifierPresetTable.lookup(tone);

        EngagementLevels target = new EngagementLevels(
            lengthFor(severity),
            initiationFor(trustScore),
            cooperationFor(preset, at));

        if (advanceRamp) {
            engagement = EngagementRamp.advance(engagement, target, recovering);
        } else if (!recovering) {
            engagement = target;
        }
        if (recovering && EngagementRamp.reached(engagement, target)) {
            recovering = false;
            log.info("Engagement fully recovered. trust={} at={}", trustScore, at);
        }

        double vulnerability = Math.min(preset.vulnerabilityCap(),
            emotionalSafety / 100.0 * Math.min(1.0, trustScore / TrustDynamicsEngine.RESILIENCE_THRESHOLD));

        currentTone = tone;
        currentModifiers = new ResponseModifiers(
            bounded("responseLengthMultiplier", engagement.responseLength(), 0.3, 1.0),
            bounded("initiationProbability",    engagement.initiation(),     0.0, 1.0),
            bounded("cooperationLevel",         engagement.cooperation(),    0.0, 1.0),
            bounded("emotionalVulnerability",   vulnerability,               0.0, 1.0),
            bounded("interpretationBias",       biasFor(trustScore, resentmentScore), -1.0, 1.0));

        currentState = new PersonalityState(
            bounded("trustScore",      trustScore,      0.0, 100.0),
            bounded("resentmentScore", resentmentScore, 0.0, 100.0),
            bounded("emotionalSafety", emotionalSafety, 0.0, 100.0),
            bounded("parentingUnity",  parentingUnity,  0.0, 100.0),
            trust.isInWithdrawal(),
            severity,
            List.copyOf(activePatterns),
            memory.getDominantEmotions(DOMINANT_EMOTION_LIMIT, at));
    }

    private static double lengthFor(WithdrawalSeverity severity) {
        return switch (severity) {
            case NONE     -> 1.0;
            case MILD     -> 0.7;
            case MODERATE -> 0.5;
            case SEVERE   -> 0.3;
        };
    }

    private double initiationFor(double trustScore) {
        double base;
        if (trustScore > 70.0) {
            base = 1.0;
        } else if (trustScore >= 40.0) {
            base = Math.max(MIN_INITIATION, (trustScore - 40.0) / 30.0);
        } else {
            base = MIN_INITIATION;
        }
        if (initiationStreak >= INITIATION_STREAK_THRESHOLD) {
            base += INITIATION_STREAK_BONUS;
        }
        return ScoreMath.round2(ScoreMath.clampUnit(base));
    }

    private double cooperationFor(ModifierPreset preset, Instant at) {
        double cooperation = preset.cooperationBase();
        if (activePatterns.contains(PatternType.CONTROL_TAKING)) {
            double pressure = patterns.getPatternFrequency(PatternType.CONTROL_TAKING, at)
                * CONTROL_DAMPENING_RATE
                * patterns.getPatternWeight(PatternType.CONTROL_TAKING, at);
            cooperation *= 1.0 - Math.min(CONTROL_DAMPENING_CAP, pressure);
        }
        return ScoreMath.round2(ScoreMath.clampUnit(cooperation));
    }

    private static double biasFor(double trustScore, double resentmentScore) {
        if (resentmentScore > 50.0) return ScoreMath.round2(-(resentmentScore - 50.0) / 50.0);
        if (trustScore > 70.0)      return ScoreMath.round2((trustScore - 70.0) / 30.0);
        return 0.0;
    }

    /** {@code 1 / (1 + variance)} of daily PARENTING_PRESENT counts over the last week. */
    double parentingConsistency(Instant at) {
        int[] daily = new int[CONSISTENCY_DAYS];
        Instant cutoff = at.minus(Duration.ofDays(CONSISTENCY_DAYS));
        for (PlayerAction a : patterns.getHistory()) {
            if (a.actionType() != ActionType.PARENTING_PRESENT) continue;
            if (!a.timestamp().isAfter(cutoff) || a.timestamp().isAfter(at)) continue;
            int bucket = (int) (Duration.between(a.timestamp(), at).toMillis() / MILLIS_PER_DAY);
            daily[Math.min(bucket, CONSISTENCY_DAYS - 1)]++;
        }
        double mean = 0.0;
        for (int c : daily) mean += c;
        mean /= CONSISTENCY_DAYS;
        double variance = 0.0;
        for (int c : daily) variance += (c - mean) * (c - mean);
        variance /= CONSISTENCY_DAYS;
        return 1.0 / (1.0 + variance);
    }

    /** Clamps an out-of-range derived value and reports it; in-range values pass through rounded. */
    private static double bounded(String field, double value, double min, double max) {
        if (!Double.isFinite(value)) {
            log.warn("Non-finite derived value replaced. field={} value={} replacement={}", field, value, min);
            return min;
        }
        if (value < min || value > max) {
            log.warn("Derived value clamped. field={} value={} range=[{}, {}]", field, value, min, max);
        }
        return ScoreMath.round2(ScoreMath.clamp(value, min, max));
    }

    // ── reads ───────────────────────────────────────────────────────────────

    public PersonalityState getCurrentState() {
        return currentState;
    }

    public ResponseModifiers getResponseModifiers() {
        return currentModifiers;
    }

    public RelationshipTone getCurrentTone() {
        return currentTone;
    }

    public ToneStrategy getToneStrategy() {
        return ModifierPresetTable.lookup(currentTone).strategy();
    }

    public SubPatternSummary getSubPatternSummary(Instant now) {
        Instant cutoff = now.minus(PatternTracker.DEFAULT_WINDOW);
        int engagements = 0, avoidances = 0, acknowledgments = 0, dismissals = 0;
        for (PlayerAction a : patterns.getHistory()) {
            if (a.timestamp().isBefore(cutoff) || a.timestamp().isAfter(now)) continue;
            ActionType type = a.actionType();
            if (type == ActionType.CONFLICT_ENGAGE) engagements++;
            if (type == ActionType.CONFLICT_AVOID)  avoidances++;
            if (ACKNOWLEDGMENTS.contains(type))     acknowledgments++;
            if (DISMISSALS.contains(type))          dismissals++;
        }
        return new SubPatternSummary(
            engagements,
            avoidances,
            ScoreMath.round2(parentingConsistency(now)),
            ScoreMath.round2(patterns.getPatternFrequency(PatternType.CONTROL_TAKING, now)),
            ScoreMath.round2(patterns.getPatternFrequency(PatternType.SUPPORTIVE_AUTONOMY, now)),
            acknowledgments,
            dismissals,
            initiationStreak);
    }

    public PatternTracker getPatternTracker() {
        return patterns;
    }

    public EmotionalMemorySystem getMemorySystem() {
        return memory;
    }

    public TrustDynamicsEngine getTrustEngine() {
        return trust;
    }

    public Instant getLastProcessed() {
        return lastProcessed;
    }

    public long getRejectedOutOfOrder() {
        return rejectedOutOfOrder;
    }

    public long getDiscardedUnstable() {
        return discardedUnstable;
    }

    // ── snapshot / restore ──────────────────────────────────────────────────

    public RelationshipSnapshot snapshot() {
        return snapshot(clock.instant());
    }

    /** Captures the full subsystem state. Read-only. */
    public RelationshipSnapshot snapshot(Instant now) {
        TrackingState tracking = new TrackingState(
            patterns.getHistory(),
            patterns.getOpposingStreaks(),
            patterns.getBrokenAt(),
            memory.getFlags(),
            trust.getPositiveRunStarted(),
            trust.getLastResentmentDecay(),
            initiationStreak,
            engagement,
            recovering,
            lastProcessed,
            trust.isInWithdrawal());
        return new RelationshipSnapshot(
            RelationshipSnapshot.CURRENT_VERSION,
            now,
            trust.getTrustScore(),
            trust.getResentmentScore(),
            emotionalSafety,
            parentingUnity,
            patterns.getAllPatterns(now),
            memory.getAllMemories(),
            trust.getApologyRecords(),
            tracking);
    }

    /**
     * Replaces all state with {@code snapshot}. Out-of-range scores are clamped and logged;
     * derived state is recomputed at the snapshot time.
     */
    public void restore(RelationshipSnapshot snapshot) {
        TrackingState tracking = snapshot.tracking() == null ? TrackingState.empty() : snapshot.tracking();
        Instant savedAt = snapshot.timestamp() == null ? clock.instant() : snapshot.timestamp();

        trust.restore(
            bounded("trustScore",      snapshot.trustScore(),      0.0, 100.0),
            bounded("resentmentScore", snapshot.resentmentScore(), 0.0, 100.0),
            snapshot.apologyEffectiveness(),
            tracking.positiveRunStarted(),
            tracking.lastResentmentDecay(),
            tracking.withdrawn());
        emotionalSafety = bounded("emotionalSafety", snapshot.emotionalSafety(), 0.0, 100.0);
        parentingUnity  = bounded("parentingUnity",  snapshot.parentingUnity(),  0.0, 100.0);

        patterns.restore(tracking.actionHistory(), snapshot.patterns(),
            tracking.patternStreaks(), tracking.patternBrokenAt(), savedAt);
        memory.restore(snapshot.emotionalMemories(), tracking.playerFlags());

        initiationStreak = Math.max(0, tracking.initiationStreak());
        engagement       = tracking.engagement();
        recovering       = tracking.recovering();
        lastProcessed    = tracking.lastProcessed();
        if (lastProcessed == null && !patterns.getHistory().isEmpty()) {
            lastProcessed = patterns.getHistory().get(patterns.getHistory().size() - 1).timestamp();
        }

        activePatterns = EnumSet.noneOf(PatternType.class);
        patterns.detectPatterns(PatternTracker.DEFAULT_WINDOW, savedAt)
            .forEach(p -> activePatterns.add(p.patternType()));
        derive(savedAt, false);

        log.info("State restored. trust={} resentment={} patterns={} memories={} savedAt={}",
            trust.getTrustScore(), trust.getResentmentScore(),
            snapshot.patterns().size(), memory.size(), savedAt);
    }
}
