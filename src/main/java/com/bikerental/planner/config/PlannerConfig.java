package com.bikerental.planner.config;

import com.bikerental.planner.planning.PurchasePlanner;
import com.bikerental.planner.scoring.ScoringEngine;
import com.bikerental.planner.scoring.ScoringFormula;
import com.bikerental.planner.scoring.WeightedSumFormula;
import com.bikerental.planner.selection.PurchaseSelector;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PlannerConfig {

    @Bean
    public ScoringFormula scoringFormula() {
        return new WeightedSumFormula();
    }

    @Bean
    public ScoringEngine scoringEngine(ScoringFormula formula) {
        return new ScoringEngine(formula);
    }

    @Bean
    public PurchaseSelector purchaseSelector(PlannerProperties properties) {
        return new PurchaseSelector(properties.getSelection().getPriceScale(), properties.getSelection().getMaxDpCells());
    }

    @Bean
    public PurchasePlanner purchasePlanner(ScoringEngine scoringEngine, PurchaseSelector purchaseSelector) {
        return new PurchasePlanner(scoringEngine, purchaseSelector);
    }
}
