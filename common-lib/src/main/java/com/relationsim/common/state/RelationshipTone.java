package com.relationsim.common.state;

/**
 * Tagged combination of trust and resentment bands; the lookup key for
 * {@link ModifierPresetTable}.
 */
public record RelationshipTone(TrustBand trustBand, ResentmentBand resentmentBand) {

    public static RelationshipTone of(double trust, double resentment) {
        return new RelationshipTone(TrustBand.of(trust), ResentmentBand.of(resentment));
    }
}
