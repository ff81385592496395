package com.bikerental.planner.scoring;

import com.bikerental.planner.domain.DomainModels.BicycleRecord;
import com.bikerental.planner.error.EmptyCatalogException;
import com.bikerental.planner.error.InvalidWeightException;
import com.bikerental.planner.scoring.ScoringModels.FactorScore;
import com.bikerental.planner.scoring.ScoringModels.NormalizedWeights;
import com.bikerental.planner.scoring.ScoringModels.PreferenceWeights;
import com.bikerental.planner.scoring.ScoringModels.RecommendationScore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns eligible bicycles into ranked recommendation scores. Stateless; one instance is shared by
 * concurrent planning calls.
 */
public class ScoringEngine {
    private final ScoringFormula formula;

    public ScoringEngine(ScoringFormula formula) {
        this.formula = formula;
    }

    public String formulaName() {
        return formula.name();
    }

    /**
     * Scores every record and returns the scores in rank order (rank 1 first). Ties on rawScore go to
     * the cheaper bicycle, then to the lower id.
     */
    public List<RecommendationScore> score(List<BicycleRecord> eligible, PreferenceWeights weights) {
        validateWeights(weights);
        if (eligible == null || eligible.isEmpty()) {
            throw new EmptyCatalogException("No eligible bicycles to score");
        }
        NormalizedWeights w = normalize(weights);

        double minPrice = eligible.stream().mapToDouble(BicycleRecord::price).min().orElse(0.0);
        double maxPrice = eligible.stream().mapToDouble(BicycleRecord::price).max().orElse(0.0);

        List<Unranked> unranked = new ArrayList<>(eligible.size());
        for (BicycleRecord bike : eligible) {
            double priceEfficiency = priceEfficiency(bike.price(), minPrice, maxPrice);
            double raw = formula.combine(w, bike.conditionScore(), bike.popularityScore(), priceEfficiency);
            unranked.add(new Unranked(bike, raw, List.of(
                    new FactorScore(ScoringModels.CONDITION, bike.conditionScore()),
                    new FactorScore(ScoringModels.POPULARITY, bike.popularityScore()),
                    new FactorScore(ScoringModels.PRICE_EFFICIENCY, priceEfficiency)
            )));
        }

        unranked.sort(Comparator.comparingDouble(Unranked::rawScore).reversed()
                .thenComparingDouble(u -> u.bike().price())
                .thenComparingLong(u -> u.bike().id()));

        List<RecommendationScore> ranked = new ArrayList<>(unranked.size());
        for (int i = 0; i < unranked.size(); i++) {
            Unranked u = unranked.get(i);
            ranked.add(new RecommendationScore(u.bike().id(), u.bike().price(), u.rawScore(), i + 1, u.factors()));
        }
        return List.copyOf(ranked);
    }

    public static void validateWeights(PreferenceWeights weights) {
        if (weights == null) return;
        check(ScoringModels.CONDITION, weights.condition());
        check(ScoringModels.POPULARITY, weights.popularity());
        check(ScoringModels.PRICE_EFFICIENCY, weights.priceEfficiency());
    }

    /** Scales weights to sum to one; all-zero (or missing) weights become an equal three-way split. */
    public static NormalizedWeights normalize(PreferenceWeights weights) {
        double total = weights == null ? 0.0 : weights.total();
        if (total <= 0.0) {
            double third = 1.0 / 3.0;
            return new NormalizedWeights(third, third, third);
        }
        return new NormalizedWeights(weights.condition() / total, weights.popularity() / total, weights.priceEfficiency() / total);
    }

    /** 1 for the cheapest bicycle, 0 for the most expensive; 1 for everyone when all prices match. */
    static double priceEfficiency(double price, double minPrice, double maxPrice) {
        double range = maxPrice - minPrice;
        if (range <= 0.0) return 1.0;
        return 1.0 - (price - minPrice) / range;
    }

    private static void check(String factor, double value) {
        if (!(value >= 0.0) || Double.isInfinite(value)) {
            throw new InvalidWeightException(factor, value);
        }
    }

    private record Unranked(BicycleRecord bike, double rawScore, List<FactorScore> factors) {}
}
