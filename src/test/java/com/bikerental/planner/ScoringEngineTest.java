package com.bikerental.planner;

import com.bikerental.planner.domain.DomainModels.AvailabilityStatus;
import com.bikerental.planner.domain.DomainModels.BicycleRecord;
import com.bikerental.planner.domain.DomainModels.BicycleType;
import com.bikerental.planner.error.EmptyCatalogException;
import com.bikerental.planner.error.InvalidWeightException;
import com.bikerental.planner.scoring.ScoringEngine;
import com.bikerental.planner.scoring.ScoringModels;
import com.bikerental.planner.scoring.ScoringModels.PreferenceWeights;
import com.bikerental.planner.scoring.ScoringModels.RecommendationScore;
import com.bikerental.planner.scoring.WeightedSumFormula;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ScoringEngineTest {
    private final ScoringEngine engine = new ScoringEngine(new WeightedSumFormula());

    @Test
    void conditionAndPopularityOnlyRanksHigherCombinedScoreFirst() {
        List<RecommendationScore> scores = engine.score(List.of(
                bike(1, 200, 0.9, 0.5),
                bike(2, 150, 0.6, 0.9)
        ), new PreferenceWeights(0.5, 0.5, 0.0));

        assertEquals(2, scores.size());
        assertEquals(2L, scores.get(0).bicycleId());
        assertEquals(1, scores.get(0).rank());
        assertEquals(0.75, scores.get(0).rawScore(), 1e-9);
        assertEquals(1L, scores.get(1).bicycleId());
        assertEquals(0.70, scores.get(1).rawScore(), 1e-9);
    }

    @Test
    void identicalPricesGiveFullPriceEfficiencyWithoutDividingByZero() {
        List<RecommendationScore> scores = engine.score(List.of(
                bike(3, 100, 0.2, 0.2),
                bike(1, 100, 0.4, 0.1),
                bike(2, 100, 0.9, 0.3)
        ), new PreferenceWeights(0.0, 0.0, 7.0));

        for (RecommendationScore s : scores) {
            assertEquals(1.0, s.rawScore(), 1e-12);
            double priceEfficiency = s.factors().stream()
                    .filter(f -> f.name().equals(ScoringModels.PRICE_EFFICIENCY))
                    .findFirst().orElseThrow().value();
            assertEquals(1.0, priceEfficiency, 1e-12);
        }
        // equal score and price fall back to id order
        assertEquals(List.of(1L, 2L, 3L), scores.stream().map(RecommendationScore::bicycleId).toList());
    }

    @Test
    void allZeroWeightsFallBackToEqualWeighting() {
        List<RecommendationScore> scores = engine.score(List.of(
                bike(1, 100, 1.0, 0.0),
                bike(2, 300, 0.0, 1.0)
        ), new PreferenceWeights(0.0, 0.0, 0.0));

        assertEquals(1L, scores.get(0).bicycleId());
        assertEquals(2.0 / 3.0, scores.get(0).rawScore(), 1e-9);
        assertEquals(1.0 / 3.0, scores.get(1).rawScore(), 1e-9);
    }

    @Test
    void weightsAreNormalizedBeforeCombining() {
        var small = engine.score(List.of(bike(1, 10, 0.8, 0.4), bike(2, 20, 0.3, 0.6)), new PreferenceWeights(1, 2, 1));
        var large = engine.score(List.of(bike(1, 10, 0.8, 0.4), bike(2, 20, 0.3, 0.6)), new PreferenceWeights(10, 20, 10));
        assertEquals(small.get(0).rawScore(), large.get(0).rawScore(), 1e-12);
        assertEquals(small.get(1).rawScore(), large.get(1).rawScore(), 1e-12);
        assertTrue(small.get(0).rawScore() <= 1.0);
    }

    @Test
    void equalScoresPreferCheaperThenLowerId() {
        List<RecommendationScore> scores = engine.score(List.of(
                bike(5, 100, 0.5, 0.5),
                bike(3, 100, 0.5, 0.5),
                bike(4, 80, 0.5, 0.5)
        ), new PreferenceWeights(1.0, 1.0, 0.0));

        assertEquals(List.of(4L, 3L, 5L), scores.stream().map(RecommendationScore::bicycleId).toList());
        assertEquals(List.of(1, 2, 3), scores.stream().map(RecommendationScore::rank).toList());
    }

    @Test
    void ranksAreContiguousAndUnique() {
        List<BicycleRecord> bikes = new ArrayList<>();
        for (int i = 1; i <= 25; i++) {
            bikes.add(bike(i, 50 + (i * 37) % 400, (i % 5) / 4.0, (i % 3) / 2.0));
        }
        List<RecommendationScore> scores = engine.score(bikes, new PreferenceWeights(0.3, 0.3, 0.4));

        assertEquals(25, scores.size());
        Set<Integer> ranks = new HashSet<>();
        Set<Long> ids = new HashSet<>();
        for (int i = 0; i < scores.size(); i++) {
            assertEquals(i + 1, scores.get(i).rank());
            ranks.add(scores.get(i).rank());
            ids.add(scores.get(i).bicycleId());
            if (i > 0) assertTrue(scores.get(i - 1).rawScore() >= scores.get(i).rawScore());
        }
        assertEquals(25, ranks.size());
        assertEquals(25, ids.size());
    }

    @Test
    void rejectsNegativeAndNonNumericWeights() {
        List<BicycleRecord> bikes = List.of(bike(1, 100, 0.5, 0.5));
        InvalidWeightException ex = assertThrows(InvalidWeightException.class,
                () -> engine.score(bikes, new PreferenceWeights(0.5, -0.1, 0.5)));
        assertEquals(ScoringModels.POPULARITY, ex.factor());
        assertThrows(InvalidWeightException.class, () -> engine.score(bikes, new PreferenceWeights(Double.NaN, 0, 0)));
    }

    @Test
    void rejectsEmptyInput() {
        assertThrows(EmptyCatalogException.class, () -> engine.score(List.of(), PreferenceWeights.equal()));
    }

    static BicycleRecord bike(long id, double price, double condition, double popularity) {
        return new BicycleRecord(id, "Brand-" + id, BicycleType.ROAD, "M", price, condition, popularity, AvailabilityStatus.AVAILABLE);
    }
}
