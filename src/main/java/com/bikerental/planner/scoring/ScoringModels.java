package com.bikerental.planner.scoring;

import java.util.List;

public class ScoringModels {
    /** Buyer supplied weights. They need not sum to one; the engine normalizes them. */
    public record PreferenceWeights(double condition, double popularity, double priceEfficiency) {
        public static PreferenceWeights equal() {
            return new PreferenceWeights(1.0, 1.0, 1.0);
        }

        public double total() {
            return condition + popularity + priceEfficiency;
        }
    }

    public record NormalizedWeights(double condition, double popularity, double priceEfficiency) {}

    public record FactorScore(String name, double value) {}

    /** Only comparable with scores produced by the same invocation. */
    public record RecommendationScore(long bicycleId,
                                      double price,
                                      double rawScore,
                                      int rank,
                                      List<FactorScore> factors) {}

    public static final String CONDITION = "condition";
    public static final String POPULARITY = "popularity";
    public static final String PRICE_EFFICIENCY = "price_efficiency";
}
