package com.relationsim.relationship.persistence;

import com.relationsim.common.exception.StateValidationException;
import com.relationsim.common.model.ApologyRecord;
import com.relationsim.common.model.BehaviorPattern;
import com.relationsim.common.model.EmotionalMemory;
import com.relationsim.common.model.EngagementLevels;
import com.relationsim.common.model.RelationshipSnapshot;
import com.relationsim.common.model.TrackingState;
import com.relationsim.common.trust.TrustDynamicsEngine;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Range checks for a deserialized {@link RelationshipSnapshot}.
 *
 * <p>Any violation throws {@link StateValidationException}; the persistence layer then
 * discards the document and falls back to defaults. Stateless and thread-safe.
 */
@Component
public class SnapshotValidator {

    static final String COMPONENT = "SnapshotValidator";

    public static final int SUPPORTED_MAJOR_VERSION = 1;

    public void validate(RelationshipSnapshot snapshot) {
        checkVersion(snapshot.version());
        if (snapshot.timestamp() == null) {
            throw new StateValidationException(COMPONENT, "timestamp", "missing");
        }

        checkRange("trust_score",      snapshot.trustScore(),      0.0, 100.0);
        checkRange("resentment_score", snapshot.resentmentScore(), 0.0, 100.0);
        checkRange("emotional_safety", snapshot.emotionalSafety(), 0.0, 100.0);
        checkRange("parenting_unity",  snapshot.parentingUnity(),  0.0, 100.0);

        for (BehaviorPattern p : snapshot.patterns()) {
            if (p.patternType() == null || p.firstSeen() == null || p.lastSeen() == null) {
                throw new StateValidationException(COMPONENT, "patterns", "incomplete pattern entry");
            }
            checkRange("patterns.weight",    p.weight(),    0.0, 1.0);
            checkRange("patterns.frequency", p.frequency(), 0.0, Double.MAX_VALUE);
        }

        for (EmotionalMemory m : snapshot.emotionalMemories()) {
            if (m.emotionalImpact() == null || m.timestamp() == null || m.context() == null) {
                throw new StateValidationException(COMPONENT, "emotional_memories", "incomplete memory entry");
            }
            if (m.emotionalImpact().primaryEmotion() == null) {
                throw new StateValidationException(COMPONENT, "emotional_memories.primary_emotion", "missing");
            }
            if (m.emotionalImpact().contextCategory() == null) {
                throw new StateValidationException(COMPONENT, "emotional_memories.context_category", "missing");
            }
            checkRange("emotional_memories.weight",    m.weight(),                       0.0, 1.0);
            checkRange("emotional_memories.intensity", m.emotionalImpact().intensity(), 0.0, 1.0);
            checkRange("emotional_memories.valence",   m.emotionalImpact().valence(),  -1.0, 1.0);
        }

        for (Map.Entry<?, ApologyRecord> e : snapshot.apologyEffectiveness().entrySet()) {
            if (e.getKey() == null || e.getValue() == null) {
                throw new StateValidationException(COMPONENT, "apology_effectiveness", "null entry");
            }
            checkRange("apology_effectiveness." + e.getKey(), e.getValue().effectiveness(),
                TrustDynamicsEngine.MIN_EFFECTIVENESS, TrustDynamicsEngine.MAX_EFFECTIVENESS);
        }

        if (snapshot.tracking() != null) {
            checkTracking(snapshot.tracking());
        }
    }

    private void checkTracking(TrackingState tracking) {
        if (tracking.initiationStreak() < 0) {
            throw new StateValidationException(COMPONENT, "tracking.initiation_streak",
                "negative: " + tracking.initiationStreak());
        }
        for (Integer streak : tracking.patternStreaks().values()) {
            if (streak == null || streak < 0) {
                throw new StateValidationException(COMPONENT, "tracking.pattern_streaks", "invalid: " + streak);
            }
        }
        EngagementLevels engagement = tracking.engagement();
        checkRange("tracking.engagement.response_length", engagement.responseLength(), 0.3, 1.0);
        checkRange("tracking.engagement.initiation",      engagement.initiation(),     0.0, 1.0);
        checkRange("tracking.engagement.cooperation",     engagement.cooperation(),    0.0, 1.0);
    }

    private void checkVersion(String version) {
        if (version == null || version.isBlank()) {
            throw new StateValidationException(COMPONENT, "version", "missing");
        }
        String major = version.split("\\.", 2)[0];
        if (!String.valueOf(SUPPORTED_MAJOR_VERSION).equals(major)) {
            throw new StateValidationException(COMPONENT, "version", "unsupported major version " + version);
        }
    }

    private static void checkRange(String field, double value, double min, double max) {
        if (!Double.isFinite(value) || value < min || value > max) {
            throw new StateValidationException(COMPONENT, field,
                "value " + value + " outside [" + min + ", " + max + "]");
        }
    }
}
