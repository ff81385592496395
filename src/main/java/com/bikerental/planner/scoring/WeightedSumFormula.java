package com.bikerental.planner.scoring;

import com.bikerental.planner.scoring.ScoringModels.NormalizedWeights;

public class WeightedSumFormula implements ScoringFormula {
    @Override
    public String name() {
        return "weighted-sum";
    }

    @Override
    public double combine(NormalizedWeights w, double condition, double popularity, double priceEfficiency) {
        return w.condition() * condition + w.popularity() * popularity + w.priceEfficiency() * priceEfficiency;
    }
}
