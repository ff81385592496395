package com.bikerental.planner.catalog;

import com.bikerental.planner.domain.DomainModels.BicycleRecord;

import java.util.List;

/**
 * Source of catalog snapshots for planning. Each call returns a fresh immutable list; callers never
 * receive a live view of the underlying store.
 */
public interface CatalogReader {
    List<BicycleRecord> snapshot();
}
