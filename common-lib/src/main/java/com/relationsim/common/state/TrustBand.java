package com.relationsim.common.state;

/**
 * Coarse trust level used to key the modifier preset table.
 */
public enum TrustBand {
    /** Below 40: deep withdrawal. */
    LOW,
    /** 40 to 50: mild withdrawal. */
    GUARDED,
    /** 50 to 70 inclusive. */
    STEADY,
    /** Above 70. */
    HIGH;

    public static TrustBand of(double trust) {
        if (trust > 70.0)  return HIGH;
        if (trust >= 50.0) return STEADY;
        if (trust >= 40.0) return GUARDED;
        return LOW;
    }
}
