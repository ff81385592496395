package com.bikerental.planner.selection;

import java.util.List;

public class SelectionModels {
    /** A scored bicycle joined with its price. */
    public record Candidate(long bicycleId, double price, double score, int rank) {}

    public enum SelectionStrategy {
        EXACT_DP(true),
        GREEDY_FALLBACK(false);

        private final boolean optimal;

        SelectionStrategy(boolean optimal) {
            this.optimal = optimal;
        }

        /** Whether totalScore is guaranteed to be the best achievable for the budget. */
        public boolean optimal() {
            return optimal;
        }
    }

    public record PurchasePlan(List<Long> bicycleIds,
                               double totalCost,
                               double totalScore,
                               double budget,
                               double budgetRemaining,
                               SelectionStrategy strategy) {
        public static PurchasePlan empty(double budget, SelectionStrategy strategy) {
            return new PurchasePlan(List.of(), 0.0, 0.0, budget, budget, strategy);
        }

        public boolean isEmpty() {
            return bicycleIds.isEmpty();
        }
    }
}
