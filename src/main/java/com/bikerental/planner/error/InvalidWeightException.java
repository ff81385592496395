package com.bikerental.planner.error;

public class InvalidWeightException extends PlanningException {
    private final String factor;
    private final double value;

    public InvalidWeightException(String factor, double value) {
        super("invalid_weight", "Weight for " + factor + " must be a non-negative number, got " + value);
        this.factor = factor;
        this.value = value;
    }

    public String factor() {
        return factor;
    }

    public double value() {
        return value;
    }
}
