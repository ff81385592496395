package com.bikerental.planner.error;

public class NegativeBudgetException extends PlanningException {
    private final double budget;

    public NegativeBudgetException(double budget) {
        super("negative_budget", "Budget must be a non-negative amount, got " + budget);
        this.budget = budget;
    }

    public double budget() {
        return budget;
    }
}
