package com.bikerental.planner.planning;

import com.bikerental.planner.domain.DomainModels.BicycleRecord;
import com.bikerental.planner.domain.DomainModels.BicycleType;
import com.bikerental.planner.domain.DomainModels.FrameSizes;
import com.bikerental.planner.scoring.ScoringModels.RecommendationScore;
import com.bikerental.planner.selection.SelectionModels.PurchasePlan;
import com.bikerental.planner.selection.SelectionModels.SelectionStrategy;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

public class PlanningModels {
    /** Empty or null sets mean "any"; a null minCondition means no floor. */
    public record PlanFilters(Set<BicycleType> types, Set<String> frameSizes, Double minCondition) {
        public PlanFilters {
            types = types == null ? Set.of() : Set.copyOf(types);
            frameSizes = frameSizes == null ? Set.of() : frameSizes.stream()
                    .map(FrameSizes::normalize)
                    .filter(s -> s != null)
                    .collect(Collectors.toUnmodifiableSet());
        }

        public static PlanFilters none() {
            return new PlanFilters(Set.of(), Set.of(), null);
        }

        public boolean matches(BicycleRecord bike) {
            if (!types.isEmpty() && !types.contains(bike.type())) return false;
            if (!frameSizes.isEmpty() && (bike.frameSize() == null || !frameSizes.contains(bike.frameSize()))) return false;
            return minCondition == null || bike.conditionScore() >= minCondition;
        }
    }

    public enum EmptyReason {
        NONE,
        /** The snapshot held no AVAILABLE bicycle at all. */
        NO_CATALOG_DATA,
        /** AVAILABLE bicycles existed but the buyer filters removed every one. */
        FILTERS_EXCLUDED_ALL
    }

    public record PlanDiagnostics(SelectionStrategy strategy,
                                  String scoringFormula,
                                  int catalogSize,
                                  int availableCount,
                                  int candidatesConsidered,
                                  EmptyReason emptyReason,
                                  int selectedCount,
                                  double budgetUtilizationPercent) {}

    public record PlanResult(PurchasePlan plan, PlanDiagnostics diagnostics, List<RecommendationScore> ranking) {}
}
