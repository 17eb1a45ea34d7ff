package com.relationsim.common.exception;

public class RelationshipException extends RuntimeException {
    private final String component;

    public RelationshipException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public RelationshipException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
