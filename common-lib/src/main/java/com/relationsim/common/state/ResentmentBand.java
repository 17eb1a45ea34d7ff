package com.relationsim.common.state;

/**
 * Coarse resentment level. Each band carries the cooperation base it allows.
 */
public enum ResentmentBand {
    LOW(1.0),
    SIMMERING(0.7),
    BITTER(0.4),
    HOSTILE(0.2);

    private final double cooperationBase;

    ResentmentBand(double cooperationBase) {
        this.cooperationBase = cooperationBase;
    }

    public double cooperationBase() {
        return cooperationBase;
    }

    public static ResentmentBand of(double resentment) {
        if (resentment < 30.0) return LOW;
        if (resentment < 50.0) return SIMMERING;
        if (resentment < 70.0) return BITTER;
        return HOSTILE;
    }
}
