package com.relationsim.common.model;

/**
 * Whether an interaction happened in front of the child (PUBLIC) or between
 * the two parents only (PRIVATE). Public interactions carry amplified impact.
 */
public enum ContextType {
    PUBLIC,
    PRIVATE
}
