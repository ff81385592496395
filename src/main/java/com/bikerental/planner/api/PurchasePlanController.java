package com.bikerental.planner.api;

import com.bikerental.planner.domain.DomainModels.BicycleType;
import com.bikerental.planner.error.InvalidPlanRequestException;
import com.bikerental.planner.planning.PlanningModels.PlanFilters;
import com.bikerental.planner.planning.PlanningModels.PlanResult;
import com.bikerental.planner.scoring.ScoringModels.PreferenceWeights;
import com.bikerental.planner.service.PurchasePlanService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashSet;
import java.util.Set;

@RestController
@RequestMapping("/api/purchase-plans")
public class PurchasePlanController {
    private final PurchasePlanService planService;

    public PurchasePlanController(PurchasePlanService planService) {
        this.planService = planService;
    }

    @PostMapping
    public ResponseEntity<PlanResult> plan(@RequestBody PlanRequest request) {
        if (request.budget() == null) {
            throw new InvalidPlanRequestException("budget is required");
        }
        return ResponseEntity.ok(planService.plan(request.budget(), toWeights(request.weights()), toFilters(request.filters()), request.maxItems()));
    }

    private PreferenceWeights toWeights(WeightsRequest w) {
        if (w == null) return PreferenceWeights.equal();
        return new PreferenceWeights(
                w.condition() == null ? 0.0 : w.condition(),
                w.popularity() == null ? 0.0 : w.popularity(),
                w.priceEfficiency() == null ? 0.0 : w.priceEfficiency());
    }

    private PlanFilters toFilters(FiltersRequest f) {
        if (f == null) return PlanFilters.none();
        Set<BicycleType> types = new HashSet<>();
        if (f.types() != null) {
            for (String label : f.types()) {
                BicycleType type = BicycleType.fromLabel(label);
                if (type == null) {
                    throw new InvalidPlanRequestException("Unknown bicycle type in filters: " + label);
                }
                types.add(type);
            }
        }
        return new PlanFilters(types, f.frameSizes(), f.minCondition());
    }

    public record PlanRequest(Double budget, WeightsRequest weights, FiltersRequest filters, Integer maxItems) {}

    public record WeightsRequest(Double condition, Double popularity, Double priceEfficiency) {}

    public record FiltersRequest(Set<String> types, Set<String> frameSizes, Double minCondition) {}
}
