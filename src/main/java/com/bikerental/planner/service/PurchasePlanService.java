package com.bikerental.planner.service;

import com.bikerental.planner.catalog.CatalogReader;
import com.bikerental.planner.config.PlannerProperties;
import com.bikerental.planner.planning.PlanningModels.PlanFilters;
import com.bikerental.planner.planning.PlanningModels.PlanResult;
import com.bikerental.planner.planning.PurchasePlanner;
import com.bikerental.planner.scoring.ScoringModels.PreferenceWeights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class PurchasePlanService {
    private static final Logger log = LoggerFactory.getLogger(PurchasePlanService.class);

    private final CatalogReader catalogReader;
    private final PurchasePlanner planner;
    private final PlannerProperties properties;

    public PurchasePlanService(CatalogReader catalogReader, PurchasePlanner planner, PlannerProperties properties) {
        this.catalogReader = catalogReader;
        this.planner = planner;
        this.properties = properties;
    }

    public PlanResult plan(double budget, PreferenceWeights weights, PlanFilters filters, Integer maxItems) {
        Integer limit = maxItems != null ? maxItems : properties.getSelection().getDefaultMaxItems();
        PlanResult result = planner.plan(catalogReader.snapshot(), weights, budget, filters, limit);
        log.info("plan.done budget={} selected={} totalCost={} strategy={} candidates={}",
                budget,
                result.diagnostics().selectedCount(),
                result.plan().totalCost(),
                result.plan().strategy(),
                result.diagnostics().candidatesConsidered());
        return result;
    }
}
