package com.relationsim.common.state;

/**
 * Conversational stance suggested to the dialogue layer for a {@link RelationshipTone}.
 */
public enum ToneStrategy {
    OPEN,
    RECEPTIVE,
    CAUTIOUS,
    DEFENSIVE,
    GUARDED,
    WITHDRAWN
}
