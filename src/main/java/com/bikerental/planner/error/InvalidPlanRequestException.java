package com.bikerental.planner.error;

/** Malformed planning request: missing budget, negative item limit or an unknown filter label. */
public class InvalidPlanRequestException extends PlanningException {
    public InvalidPlanRequestException(String message) {
        super("invalid_request", message);
    }
}
