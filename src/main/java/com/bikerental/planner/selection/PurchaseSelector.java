package com.bikerental.planner.selection;

import com.bikerental.planner.error.InvalidPlanRequestException;
import com.bikerental.planner.error.NegativeBudgetException;
import com.bikerental.planner.selection.SelectionModels.Candidate;
import com.bikerental.planner.selection.SelectionModels.PurchasePlan;
import com.bikerental.planner.selection.SelectionModels.SelectionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Picks the subset of candidates with the highest total score whose total cost fits the budget.
 *
 * <p>Prices are converted to integer cost units ({@code priceScale} units per currency unit) and
 * solved exactly as a 0/1 knapsack. When a price is not a whole number of units, or the state
 * space sized by the candidates' total cost would exceed {@code maxDpCells}, a score-per-price
 * greedy fill is used instead and the plan is tagged {@link SelectionStrategy#GREEDY_FALLBACK}.
 * The budget never takes part in that choice.
 */
public class PurchaseSelector {
    private static final Logger log = LoggerFactory.getLogger(PurchaseSelector.class);
    private static final double EPS = 1e-9;

    private final int priceScale;
    private final long maxDpCells;

    public PurchaseSelector(int priceScale, long maxDpCells) {
        if (priceScale <= 0) throw new IllegalArgumentException("priceScale must be positive");
        this.priceScale = priceScale;
        this.maxDpCells = maxDpCells;
    }

    public PurchasePlan select(List<Candidate> candidates, double budget, Integer maxItems) {
        if (!(budget >= 0.0)) {
            throw new NegativeBudgetException(budget);
        }
        // zero-value items never improve a plan
        List<Candidate> items = candidates == null ? List.of() : candidates.stream()
                .filter(c -> c.score() > 0.0)
                .sorted(Comparator.comparingDouble(Candidate::price).thenComparingLong(Candidate::bicycleId))
                .toList();
        if (maxItems != null && maxItems < 0) {
            throw new InvalidPlanRequestException("maxItems must not be negative, got " + maxItems);
        }
        int limit = maxItems == null ? items.size() : Math.min(maxItems, items.size());

        // the strategy depends on the catalog only, so one catalog never changes strategy as the budget moves
        long[] units = quantize(items);
        if (units == null) {
            log.debug("selection.greedy reason=unquantizable items={}", items.size());
            return greedy(items, budget, limit);
        }
        long totalUnits = 0;
        for (long u : units) totalUnits += u;
        boolean limited = limit < items.size();
        double layerCells = (double) (limited ? limit + 1 : 1) * (totalUnits + 1);
        double cells = items.size() * layerCells;
        if (cells > maxDpCells || layerCells > Integer.MAX_VALUE - 8) {
            log.debug("selection.greedy reason=state_space cells={} max={}", (long) cells, maxDpCells);
            return greedy(items, budget, limit);
        }

        long capacity = Math.min(budgetUnits(budget), totalUnits);
        log.debug("selection.exact items={} capacityUnits={} limit={}", items.size(), capacity, limited ? limit : "none");
        return exact(items, units, (int) capacity, limited ? limit : -1, budget);
    }

    private PurchasePlan exact(List<Candidate> items, long[] units, int capacity, int limit, double budget) {
        int n = items.size();
        boolean limited = limit >= 0;
        int layers = limited ? limit + 1 : 1;
        int width = capacity + 1;

        // best[k * width + c]: best score using exactly cost c (and exactly k items when limited)
        double[] best = new double[layers * width];
        Arrays.fill(best, Double.NEGATIVE_INFINITY);
        best[0] = 0.0;
        boolean[][] taken = new boolean[n][layers * width];

        for (int i = 0; i < n; i++) {
            int u = (int) units[i];
            double s = items.get(i).score();
            for (int k = layers - 1; k >= (limited ? 1 : 0); k--) {
                int from = limited ? k - 1 : k;
                for (int c = capacity; c >= u; c--) {
                    double prev = best[from * width + c - u];
                    if (prev == Double.NEGATIVE_INFINITY) continue;
                    int at = k * width + c;
                    if (prev + s > best[at] + EPS) {
                        best[at] = prev + s;
                        taken[i][at] = true;
                    }
                }
            }
        }

        // highest score wins; among equal scores the cheaper, then the smaller, selection
        int bestK = 0;
        int bestC = 0;
        for (int c = 0; c <= capacity; c++) {
            for (int k = 0; k < layers; k++) {
                double v = best[k * width + c];
                if (v > best[bestK * width + bestC] + EPS) {
                    bestK = k;
                    bestC = c;
                }
            }
        }

        List<Candidate> chosen = new ArrayList<>();
        int k = bestK;
        int c = bestC;
        for (int i = n - 1; i >= 0 && c >= 0; i--) {
            if (taken[i][k * width + c]) {
                chosen.add(items.get(i));
                c -= (int) units[i];
                if (limited) k--;
            }
        }
        double totalCost = (double) bestC / priceScale;
        return toPlan(chosen, totalCost, budget, SelectionStrategy.EXACT_DP);
    }

    private PurchasePlan greedy(List<Candidate> items, double budget, int limit) {
        List<Candidate> order = new ArrayList<>(items);
        order.sort(Comparator.comparingDouble(PurchaseSelector::efficiency).reversed()
                .thenComparingDouble(Candidate::price)
                .thenComparingLong(Candidate::bicycleId));

        List<Candidate> chosen = new ArrayList<>();
        double spent = 0.0;
        for (Candidate c : order) {
            if (chosen.size() >= limit) break;
            if (spent + c.price() <= budget) {
                chosen.add(c);
                spent += c.price();
            }
        }
        return toPlan(chosen, spent, budget, SelectionStrategy.GREEDY_FALLBACK);
    }

    private PurchasePlan toPlan(List<Candidate> chosen, double totalCost, double budget, SelectionStrategy strategy) {
        if (chosen.isEmpty()) {
            return PurchasePlan.empty(budget, strategy);
        }
        List<Candidate> ordered = new ArrayList<>(chosen);
        ordered.sort(Comparator.comparingInt(Candidate::rank).thenComparingLong(Candidate::bicycleId));
        double totalScore = 0.0;
        for (Candidate c : ordered) totalScore += c.score();
        return new PurchasePlan(
                ordered.stream().map(Candidate::bicycleId).toList(),
                totalCost,
                totalScore,
                budget,
                Math.max(0.0, budget - totalCost),
                strategy);
    }

    /** Cost units per item, or null when some price has no exact representation at this scale. */
    private long[] quantize(List<Candidate> items) {
        long[] units = new long[items.size()];
        for (int i = 0; i < items.size(); i++) {
            double scaled = items.get(i).price() * priceScale;
            if (Double.isInfinite(scaled) || scaled > Integer.MAX_VALUE) return null;
            long rounded = Math.round(scaled);
            if (Math.abs(scaled - rounded) > EPS * Math.max(1.0, scaled)) return null;
            units[i] = rounded;
        }
        return units;
    }

    private long budgetUnits(double budget) {
        double scaled = budget * priceScale;
        long units = scaled >= Integer.MAX_VALUE ? Integer.MAX_VALUE - 1 : (long) Math.floor(scaled + EPS);
        while (units > 0 && (double) units / priceScale > budget) {
            units--;
        }
        return units;
    }

    private static double efficiency(Candidate c) {
        return c.price() <= 0.0 ? Double.POSITIVE_INFINITY : c.score() / c.price();
    }
}
