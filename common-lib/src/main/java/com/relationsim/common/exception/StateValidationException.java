package com.relationsim.common.exception;

/**
 * A persisted or computed value falls outside its declared range.
 *
 * <p>In session the offending value is clamped; on load the whole document is
 * discarded in favor of the default state.
 */
public class StateValidationException extends RelationshipException {
    private final String field;

    public StateValidationException(String component, String field, String message) {
        super(component, field + ": " + message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
