package com.bikerental.planner.error;

import com.bikerental.planner.planning.PlanningModels.PlanDiagnostics;

public class EmptyCatalogException extends PlanningException {
    private final PlanDiagnostics diagnostics;

    public EmptyCatalogException(String message) {
        this(message, null);
    }

    public EmptyCatalogException(String message, PlanDiagnostics diagnostics) {
        super("empty_catalog", message);
        this.diagnostics = diagnostics;
    }

    /** Null when raised by the scoring engine directly rather than by the planner. */
    public PlanDiagnostics diagnostics() {
        return diagnostics;
    }
}
