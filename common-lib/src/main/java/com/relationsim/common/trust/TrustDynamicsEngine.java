package com.relationsim.common.trust;

import com.relationsim.common.math.ScoreMath;
import com.relationsim.common.model.ActionType;
import com.relationsim.common.model.ApologyRecord;
import com.relationsim.common.model.ApologyType;
import com.relationsim.common.model.ContextType;
import com.relationsim.common.model.RelationshipSnapshot;
import com.relationsim.common.model.WithdrawalSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Owns the trust and resentment scalars and the per-behavior apology table.
 *
 * <h3>Trust update pipeline</h3>
 * The signed input unit (normally the action valence) passes through, in order:
 * <ol>
 *   <li>Base rate: positive × {@value #POSITIVE_RATE}, negative × {@value #NEGATIVE_RATE}.
 *       Trust erodes twice as fast as it builds.</li>
 *   <li>Public context × {@value #PUBLIC_MULTIPLIER}, except {@link ActionType#PRIVATE_CORRECTION}.</li>
 *   <li>Diminishing returns: a same-kind positive action within one hour of the previous one
 *       contributes at most {@value #DIMINISHING_CAP} of the chain's first impact.</li>
 *   <li>High-trust resilience: above {@value #RESILIENCE_THRESHOLD}, negatives × {@value #RESILIENCE_FACTOR}.</li>
 *   <li>Resentment dampening: above {@value #DAMPENING_THRESHOLD}, positives × {@value #DAMPENING_FACTOR}.</li>
 *   <li>Clamp to [0, 100], round to two decimals.</li>
 * </ol>
 * Steps 4 and 5 compose by sequential multiplication; they never both touch one update
 * because they are sign-exclusive.
 *
 * <h3>Resentment</h3>
 * Pattern-confirmed behavior adds {@value #PATTERN_RESENTMENT} per unit against
 * {@value #ISOLATED_RESENTMENT} for an isolated incident. Decay of
 * {@value #RESENTMENT_DECAY_PER_DAY}/day accrues only while positive interactions are unbroken.
 *
 * <p>Not thread-safe. Mutation is serialized by the owning state manager.
 */
public class TrustDynamicsEngine {

    private static final Logger log = LoggerFactory.getLogger(TrustDynamicsEngine.class);

    static final String COMPONENT = "TrustDynamicsEngine";

    // ── trust rates ─────────────────────────────────────────────────────────
    public static final double POSITIVE_RATE        = 2.0;
    public static final double NEGATIVE_RATE        = 4.0;
    public static final double PUBLIC_MULTIPLIER    = 2.0;
    public static final double DIMINISHING_CAP      = 0.5;
    public static final double RESILIENCE_THRESHOLD = 70.0;
    public static final double RESILIENCE_FACTOR    = 0.7;
    public static final double DAMPENING_THRESHOLD  = 50.0;
    public static final double DAMPENING_FACTOR     = 0.5;

    static final Duration DIMINISHING_WINDOW = Duration.ofHours(1);

    // ── resentment ──────────────────────────────────────────────────────────
    public static final double PATTERN_RESENTMENT       = 3.0;
    public static final double ISOLATED_RESENTMENT      = 0.5;
    public static final double RESENTMENT_DECAY_PER_DAY = 0.5;

    // ── withdrawal ──────────────────────────────────────────────────────────
    public static final double WITHDRAWAL_THRESHOLD = 50.0;
    public static final double MILD_FLOOR           = 40.0;
    public static final double MODERATE_FLOOR       = 30.0;

    // ── apologies ───────────────────────────────────────────────────────────
    public static final double RECURRENCE_PENALTY    = 0.2;
    public static final double MIN_EFFECTIVENESS     = 0.1;
    public static final double MAX_EFFECTIVENESS     = 1.0;
    public static final double RECOVERY_PER_WEEK     = 0.1;

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();
    private static final Duration ONE_WEEK     = Duration.ofDays(7);

    private double trust      = RelationshipSnapshot.DEFAULT_TRUST;
    private double resentment = RelationshipSnapshot.DEFAULT_RESENTMENT;
    private boolean withdrawn;
    private final double withdrawalExitThreshold;

    private final Map<ActionType, ApologyRecord>    apologies = new EnumMap<>(ActionType.class);
    private final Map<ActionType, DiminishingChain> chains    = new EnumMap<>(ActionType.class);

    private Instant positiveRunStarted;
    private Instant lastResentmentDecay;

    public TrustDynamicsEngine() {
        this(WITHDRAWAL_THRESHOLD);
    }

    /**
     * @param withdrawalExitThreshold trust level that must be reached to leave withdrawal.
     *                                Entry is always below {@value #WITHDRAWAL_THRESHOLD}; a
     *                                higher exit value adds hysteresis.
     */
    public TrustDynamicsEngine(double withdrawalExitThreshold) {
        this.withdrawalExitThreshold = Math.max(WITHDRAWAL_THRESHOLD, withdrawalExitThreshold);
        this.withdrawn = trust < WITHDRAWAL_THRESHOLD;
    }

    /**
     * Result of one trust update.
     *
     * @param previous trust before the update
     * @param current  trust after clamping and rounding
     * @param applied  {@code current − previous}
     */
    public record TrustUpdate(double previous, double current, double applied) {

        public boolean crossedAbove(double threshold) {
            return previous < threshold && current >= threshold;
        }

        public boolean crossedBelow(double threshold) {
            return previous >= threshold && current < threshold;
        }
    }

    // ── trust ───────────────────────────────────────────────────────────────

    /**
     * Applies one signed trust unit through the pipeline documented on this class.
     *
     * @param deltaBase signed unit, usually the action valence in [-1, 1]
     * @param context   PUBLIC doubles the impact
     * @param kind      action kind used for the diminishing-returns chain and the
     *                  private-correction exemption; may be null
     * @param at        action timestamp
     * @throws com.relationsim.common.exception.NumericInstabilityException if the input or the
     *         result is not finite; trust is left untouched
     */
    public TrustUpdate updateTrust(double deltaBase, ContextType context, ActionType kind, Instant at) {
        ScoreMath.requireFinite(COMPONENT, "deltaBase", deltaBase);
        double previous = trust;

        double value = deltaBase > 0 ? deltaBase * POSITIVE_RATE : deltaBase * NEGATIVE_RATE;

        if (context == ContextType.PUBLIC && kind != ActionType.PRIVATE_CORRECTION) {
            value *= PUBLIC_MULTIPLIER;
        }

        DiminishingChain chain = null;
        if (value > 0 && kind != null) {
            DiminishingChain prior = chains.get(kind);
            if (prior != null && !at.isBefore(prior.lastAt())
                    && Duration.between(prior.lastAt(), at).compareTo(DIMINISHING_WINDOW) < 0) {
                value = Math.min(value, prior.firstImpact() * DIMINISHING_CAP);
                chain = new DiminishingChain(prior.firstImpact(), at);
            } else {
                chain = new DiminishingChain(value, at);
            }
        }

        if (value < 0 && previous > RESILIENCE_THRESHOLD) {
            value *= RESILIENCE_FACTOR;
        }
        if (value > 0 && resentment > DAMPENING_THRESHOLD) {
            value *= DAMPENING_FACTOR;
        }

        double next = ScoreMath.storeScore(ScoreMath.requireFinite(COMPONENT, "trust", previous + value));

        if (chain != null) chains.put(kind, chain);
        trust = next;
        updateWithdrawal();

        log.debug("Trust updated. kind={} context={} unit={} applied={} trust={}",
            kind, context, deltaBase, ScoreMath.round2(next - previous), next);
        return new TrustUpdate(previous, next, ScoreMath.round2(next - previous));
    }

    // ── resentment ──────────────────────────────────────────────────────────

    /**
     * Positive {@code delta} accumulates at the pattern or isolated rate; a negative
     * {@code delta} is applied as a direct reduction.
     *
     * @return the resentment change actually applied
     */
    public double updateResentment(double delta, boolean isPattern, Instant at) {
        ScoreMath.requireFinite(COMPONENT, "resentmentDelta", delta);
        double previous = resentment;
        double change = delta > 0
            ? delta * (isPattern ? PATTERN_RESENTMENT : ISOLATED_RESENTMENT)
            : delta;
        resentment = ScoreMath.storeScore(ScoreMath.requireFinite(COMPONENT, "resentment", previous + change));
        log.debug("Resentment updated. delta={} pattern={} resentment={} at={}",
            delta, isPattern, resentment, at);
        return ScoreMath.round2(resentment - previous);
    }

    /**
     * Tracks the unbroken run of positive interactions that resentment decay depends on.
     * Call after {@link #applyResentmentDecay(Instant)} for each action.
     */
    public void noteInteraction(boolean positive, Instant at) {
        if (positive) {
            if (positiveRunStarted == null) {
                positiveRunStarted  = at;
                lastResentmentDecay = at;
            }
        } else {
            positiveRunStarted  = null;
            lastResentmentDecay = null;
        }
    }

    /**
     * Credits decay for the time elapsed in the current positive run since the last credit.
     *
     * @return amount of resentment removed
     */
    public double applyResentmentDecay(Instant now) {
        if (positiveRunStarted == null || lastResentmentDecay == null || !now.isAfter(lastResentmentDecay)) {
            return 0.0;
        }
        double days = Duration.between(lastResentmentDecay, now).toMillis() / MILLIS_PER_DAY;
        double previous = resentment;
        resentment = ScoreMath.storeScore(previous - RESENTMENT_DECAY_PER_DAY * days);
        lastResentmentDecay = now;
        return ScoreMath.round2(previous - resentment);
    }

    // ── withdrawal ──────────────────────────────────────────────────────────

    public boolean isInWithdrawal() {
        return withdrawn;
    }

    public WithdrawalSeverity getWithdrawalSeverity() {
        if (!withdrawn)              return WithdrawalSeverity.NONE;
        if (trust >= MILD_FLOOR)     return WithdrawalSeverity.MILD;
        if (trust >= MODERATE_FLOOR) return WithdrawalSeverity.MODERATE;
        return WithdrawalSeverity.SEVERE;
    }

    private void updateWithdrawal() {
        if (trust < WITHDRAWAL_THRESHOLD) {
            withdrawn = true;
        } else if (trust >= withdrawalExitThreshold) {
            withdrawn = false;
        }
    }

    // ── apologies ───────────────────────────────────────────────────────────

    /**
     * Records an apology for {@code behavior}. Pending weekly recovery is credited first.
     *
     * @return effectiveness applied to this apology: stored effectiveness × type multiplier
     */
    public double recordApology(ActionType behavior, ApologyType type, Instant at) {
        ApologyRecord record = recovered(apologies.getOrDefault(behavior, ApologyRecord.initial()), at);
        record = record.withApology(type, at);
        apologies.put(behavior, record);
        double applied = ScoreMath.round2(record.effectiveness() * type.multiplier());
        log.info("Apology recorded. behavior={} type={} effectiveness={} applied={}",
            behavior, type, record.effectiveness(), applied);
        return applied;
    }

    /**
     * Lowers effectiveness by {@value #RECURRENCE_PENALTY} (floor {@value #MIN_EFFECTIVENESS})
     * when {@code behavior} recurs after an apology. No-op when nothing was apologized for.
     *
     * @return true if a recurrence was recorded
     */
    public boolean recordBehaviorRecurrence(ActionType behavior, Instant at) {
        ApologyRecord record = apologies.get(behavior);
        if (record == null || record.lastApologyType() == null) return false;
        record = recovered(record, at);
        double reduced = ScoreMath.round2(Math.max(MIN_EFFECTIVENESS, record.effectiveness() - RECURRENCE_PENALTY));
        apologies.put(behavior, record.withRecurrence(reduced, at));
        log.info("Apologized behavior recurred. behavior={} effectiveness={}", behavior, reduced);
        return true;
    }

    /**
     * Stored effectiveness for {@code behavior} with lazy weekly recovery applied, in
     * [{@value #MIN_EFFECTIVENESS}, {@value #MAX_EFFECTIVENESS}]. Unknown behaviors report 1.0.
     */
    public double getApologyEffectiveness(ActionType behavior, Instant now) {
        ApologyRecord record = apologies.get(behavior);
        return record == null ? MAX_EFFECTIVENESS : recovered(record, now).effectiveness();
    }

    public boolean hasApologyOnRecord(ActionType behavior) {
        ApologyRecord record = apologies.get(behavior);
        return record != null && record.lastApologyType() != null;
    }

    /** +{@value #RECOVERY_PER_WEEK} per full week since the last recurrence or credit. */
    private static ApologyRecord recovered(ApologyRecord record, Instant now) {
        Instant since = record.recoveredThrough();
        if (since == null || !now.isAfter(since)) return record;
        long weeks = Duration.between(since, now).toMillis() / ONE_WEEK.toMillis();
        if (weeks <= 0) return record;
        double restored = ScoreMath.round2(Math.min(MAX_EFFECTIVENESS,
            record.effectiveness() + RECOVERY_PER_WEEK * weeks));
        return record.withRecovery(restored, since.plus(ONE_WEEK.multipliedBy(weeks)));
    }

    // ── state access ────────────────────────────────────────────────────────

    public double getTrustScore() {
        return trust;
    }

    public double getResentmentScore() {
        return resentment;
    }

    public Map<ActionType, ApologyRecord> getApologyRecords() {
        return Collections.unmodifiableMap(apologies);
    }

    public Instant getPositiveRunStarted() {
        return positiveRunStarted;
    }

    public Instant getLastResentmentDecay() {
        return lastResentmentDecay;
    }

    /** Replaces all state. Scores are clamped and rounded; withdrawal is re-derived from trust. */
    public void restore(double trustScore,
                        double resentmentScore,
                        Map<ActionType, ApologyRecord> records,
                        Instant runStarted,
                        Instant lastDecay) {
        restore(trustScore, resentmentScore, records, runStarted, lastDecay, null);
    }

    /**
     * Replaces all state. A saved {@code wasWithdrawn} flag is honored while trust is still
     * below the exit threshold; {@code null} re-derives withdrawal from trust alone.
     */
    public void restore(double trustScore,
                        double resentmentScore,
                        Map<ActionType, ApologyRecord> records,
                        Instant runStarted,
                        Instant lastDecay,
                        Boolean wasWithdrawn) {
        trust      = ScoreMath.storeScore(trustScore);
        resentment = ScoreMath.storeScore(resentmentScore);
        withdrawn  = trust < WITHDRAWAL_THRESHOLD
            || (Boolean.TRUE.equals(wasWithdrawn) && trust < withdrawalExitThreshold);
        apologies.clear();
        apologies.putAll(records);
        chains.clear();
        positiveRunStarted  = runStarted;
        lastResentmentDecay = runStarted == null ? null : (lastDecay == null ? runStarted : lastDecay);
    }

    private record DiminishingChain(double firstImpact, Instant lastAt) {}
}
