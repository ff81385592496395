package com.bikerental.planner.catalog;

import java.util.List;

public class CatalogImportModels {
    /** Leave popularityScore null to have it derived from rental history. */
    public record BicycleIn(Long id,
                            String brand,
                            String type,
                            String frameSize,
                            Double price,
                            Double conditionScore,
                            Double popularityScore,
                            String status) {}

    /** returnDate is null while the bicycle is still out. */
    public record RentalIn(Long bicycleId, String rentalDate, String returnDate, Long memberId) {}

    public record ImportRequest(List<BicycleIn> bicycles, List<RentalIn> rentals, boolean dryRun, boolean replace) {}

    public record ImportError(String code, String message, Long bicycleId) {}

    public record ImportResult(boolean dryRun,
                               boolean valid,
                               int bicycleCount,
                               int rentalCount,
                               List<ImportError> errors) {}
}
