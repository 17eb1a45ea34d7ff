package com.relationsim.common.model;

/**
 * Coarse category an emotional memory is filed under for association queries.
 */
public enum ContextCategory {
    SUPPORT,
    CONFLICT,
    PARENTING,
    INTIMACY
}
