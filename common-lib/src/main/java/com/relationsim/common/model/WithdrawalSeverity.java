package com.relationsim.common.model;

/**
 * Withdrawal bands by trust: NONE ≥ 50, MILD 40–50, MODERATE 30–40, SEVERE &lt; 30.
 */
public enum WithdrawalSeverity {
    NONE,
    MILD,
    MODERATE,
    SEVERE
}
