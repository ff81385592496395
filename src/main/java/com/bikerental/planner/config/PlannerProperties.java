package com.bikerental.planner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "planner")
public class PlannerProperties {
    private Selection selection = new Selection();

    public Selection getSelection() { return selection; }
    public void setSelection(Selection selection) { this.selection = selection; }

    public static class Selection {
        /** Cost units per currency unit used by the exact solver; 100 means cents. */
        private int priceScale = 100;
        private long maxDpCells = 20_000_000L;
        private Integer defaultMaxItems;

        public int getPriceScale() { return priceScale; }
        public void setPriceScale(int priceScale) { this.priceScale = priceScale; }
        public long getMaxDpCells() { return maxDpCells; }
        public void setMaxDpCells(long maxDpCells) { this.maxDpCells = maxDpCells; }
        public Integer getDefaultMaxItems() { return defaultMaxItems; }
        public void setDefaultMaxItems(Integer defaultMaxItems) { this.defaultMaxItems = defaultMaxItems; }
    }
}
