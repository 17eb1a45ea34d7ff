package com.relationsim.common.state;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Lookup table from {@link RelationshipTone} to {@link ModifierPreset}.
 *
 * <h3>Strategy selection</h3>
 * <pre>
 *   trust LOW                          → WITHDRAWN
 *   trust GUARDED                      → GUARDED
 *   resentment BITTER or HOSTILE       → DEFENSIVE
 *   trust HIGH, resentment LOW         → OPEN
 *   trust HIGH, resentment SIMMERING   → RECEPTIVE
 *   otherwise                          → CAUTIOUS
 * </pre>
 *
 * <h3>Vulnerability cap</h3>
 * {@code trustCap × resentmentFactor}, where trustCap is 0.3 / 0.5 / 0.8 / 1.0 from LOW to HIGH
 * and resentmentFactor is 1.0 / 0.9 / 0.7 / 0.5 from LOW to HOSTILE.
 *
 * <p>Every combination is present. Stateless and thread-safe.
 */
public final class ModifierPresetTable {

    private static final Map<TrustBand, Double> TRUST_VULNERABILITY_CAP = new EnumMap<>(Map.of(
        TrustBand.LOW,     0.3,
        TrustBand.GUARDED, 0.5,
        TrustBand.STEADY,  0.8,
        TrustBand.HIGH,    1.0
    ));

    private static final Map<ResentmentBand, Double> RESENTMENT_VULNERABILITY_FACTOR = new EnumMap<>(Map.of(
        ResentmentBand.LOW,       1.0,
        ResentmentBand.SIMMERING, 0.9,
        ResentmentBand.BITTER,    0.7,
        ResentmentBand.HOSTILE,   0.5
    ));

    private static final Map<RelationshipTone, ModifierPreset> PRESETS = buildPresets();

    private ModifierPresetTable() {}

    public static ModifierPreset lookup(RelationshipTone tone) {
        return PRESETS.get(tone);
    }

    public static ModifierPreset lookup(double trust, double resentment) {
        return lookup(RelationshipTone.of(trust, resentment));
    }

    private static Map<RelationshipTone, ModifierPreset> buildPresets() {
        Map<RelationshipTone, ModifierPreset> presets = new HashMap<>();
        for (TrustBand trust : TrustBand.values()) {
            for (ResentmentBand resentment : ResentmentBand.values()) {
                double cap = Math.round(TRUST_VULNERABILITY_CAP.get(trust)
                    * RESENTMENT_VULNERABILITY_FACTOR.get(resentment) * 100.0) / 100.0;
                presets.put(new RelationshipTone(trust, resentment),
                    new ModifierPreset(strategyFor(trust, resentment), resentment.cooperationBase(), cap));
            }
        }
        return Map.copyOf(presets);
    }

    private static ToneStrategy strategyFor(TrustBand trust, ResentmentBand resentment) {
        if (trust == TrustBand.LOW)     return ToneStrategy.WITHDRAWN;
        if (trust == TrustBand.GUARDED) return ToneStrategy.GUARDED;
        if (resentment == ResentmentBand.BITTER || resentment == ResentmentBand.HOSTILE) {
            return ToneStrategy.DEFENSIVE;
        }
        if (trust == TrustBand.HIGH) {
            return resentment == ResentmentBand.LOW ? ToneStrategy.OPEN : ToneStrategy.RECEPTIVE;
        }
        return ToneStrategy.CAUTIOUS;
    }
}
