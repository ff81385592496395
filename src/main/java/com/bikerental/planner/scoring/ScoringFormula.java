package com.bikerental.planner.scoring;

import com.bikerental.planner.scoring.ScoringModels.NormalizedWeights;

/**
 * Combines the three factor values of a bicycle into one desirability number. Factor values and
 * weights are already normalized when this is called; implementations must return a finite value.
 */
public interface ScoringFormula {
    String name();

    double combine(NormalizedWeights weights, double condition, double popularity, double priceEfficiency);
}
