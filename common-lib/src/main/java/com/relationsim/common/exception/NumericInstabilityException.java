package com.relationsim.common.exception;

/**
 * An update produced NaN or Infinity. The update is discarded and the prior state kept.
 */
public class NumericInstabilityException extends RelationshipException {

    public NumericInstabilityException(String component, String message) {
        super(component, message);
    }
}
