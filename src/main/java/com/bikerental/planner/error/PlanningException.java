package com.bikerental.planner.error;

/**
 * Base type for rejected planning input. All subclasses are raised before any scoring or
 * selection work starts.
 */
public abstract class PlanningException extends RuntimeException {
    private final String code;

    protected PlanningException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
