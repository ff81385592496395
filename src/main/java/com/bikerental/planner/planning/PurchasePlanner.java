package com.bikerental.planner.planning;

import com.bikerental.planner.domain.DomainModels.BicycleRecord;
import com.bikerental.planner.error.EmptyCatalogException;
import com.bikerental.planner.error.InvalidPlanRequestException;
import com.bikerental.planner.error.NegativeBudgetException;
import com.bikerental.planner.planning.PlanningModels.EmptyReason;
import com.bikerental.planner.planning.PlanningModels.PlanDiagnostics;
import com.bikerental.planner.planning.PlanningModels.PlanFilters;
import com.bikerental.planner.planning.PlanningModels.PlanResult;
import com.bikerental.planner.scoring.ScoringEngine;
import com.bikerental.planner.scoring.ScoringModels.PreferenceWeights;
import com.bikerental.planner.scoring.ScoringModels.RecommendationScore;
import com.bikerental.planner.selection.PurchaseSelector;
import com.bikerental.planner.selection.SelectionModels.Candidate;
import com.bikerental.planner.selection.SelectionModels.PurchasePlan;

import java.util.List;

/**
 * Filter, score, select. Works on its own copy of the catalog and keeps no state between calls.
 */
public class PurchasePlanner {
    private final ScoringEngine scoringEngine;
    private final PurchaseSelector selector;

    public PurchasePlanner(ScoringEngine scoringEngine, PurchaseSelector selector) {
        this.scoringEngine = scoringEngine;
        this.selector = selector;
    }

    public PlanResult plan(List<BicycleRecord> catalog,
                           PreferenceWeights weights,
                           double budget,
                           PlanFilters filters,
                           Integer maxItems) {
        if (!(budget >= 0.0)) {
            throw new NegativeBudgetException(budget);
        }
        if (maxItems != null && maxItems < 0) {
            throw new InvalidPlanRequestException("maxItems must not be negative, got " + maxItems);
        }
        ScoringEngine.validateWeights(weights);
        PlanFilters f = filters == null ? PlanFilters.none() : filters;

        List<BicycleRecord> snapshot = catalog == null ? List.of() : List.copyOf(catalog);
        List<BicycleRecord> available = snapshot.stream().filter(BicycleRecord::available).toList();
        List<BicycleRecord> eligible = available.stream().filter(f::matches).toList();

        if (eligible.isEmpty()) {
            EmptyReason reason = available.isEmpty() ? EmptyReason.NO_CATALOG_DATA : EmptyReason.FILTERS_EXCLUDED_ALL;
            PlanDiagnostics diagnostics = new PlanDiagnostics(null, scoringEngine.formulaName(),
                    snapshot.size(), available.size(), 0, reason, 0, 0.0);
            throw new EmptyCatalogException(reason == EmptyReason.NO_CATALOG_DATA
                    ? "Catalog has no bicycles available for purchase planning"
                    : "Filters excluded all " + available.size() + " available bicycles", diagnostics);
        }

        List<RecommendationScore> ranking = scoringEngine.score(eligible, weights);
        List<Candidate> candidates = ranking.stream()
                .map(s -> new Candidate(s.bicycleId(), s.price(), s.rawScore(), s.rank()))
                .toList();
        PurchasePlan plan = selector.select(candidates, budget, maxItems);

        double utilization = budget == 0.0 ? 0.0 : plan.totalCost() / budget * 100.0;
        PlanDiagnostics diagnostics = new PlanDiagnostics(plan.strategy(), scoringEngine.formulaName(),
                snapshot.size(), available.size(), eligible.size(), EmptyReason.NONE,
                plan.bicycleIds().size(), utilization);
        return new PlanResult(plan, diagnostics, ranking);
    }
}
