package com.bikerental.planner.validation;

import com.bikerental.planner.catalog.CatalogImportModels.BicycleIn;
import com.bikerental.planner.catalog.CatalogImportModels.ImportError;
import com.bikerental.planner.catalog.CatalogImportModels.ImportRequest;
import com.bikerental.planner.catalog.CatalogImportModels.RentalIn;
import com.bikerental.planner.domain.DomainModels.AvailabilityStatus;
import com.bikerental.planner.domain.DomainModels.BicycleType;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

@Component
public class CatalogValidator {
    /**
     * @param storedIds ids already in the store that rental rows may reference
     */
    public List<ImportError> validate(ImportRequest request, Set<Long> storedIds) {
        List<ImportError> errors = new ArrayList<>();
        List<BicycleIn> bicycles = request.bicycles() == null ? List.of() : request.bicycles();
        List<RentalIn> rentals = request.rentals() == null ? List.of() : request.rentals();

        Map<Long, Long> counts = bicycles.stream()
                .filter(b -> b != null && b.id() != null)
                .collect(Collectors.groupingBy(BicycleIn::id, Collectors.counting()));
        counts.forEach((id, n) -> {
            if (n > 1) errors.add(new ImportError("DUPLICATE_BICYCLE", "Bicycle id appears " + n + " times: " + id, id));
        });

        for (BicycleIn b : bicycles) {
            if (b == null) {
                errors.add(new ImportError("MISSING_FIELD", "Empty bicycle row", null));
                continue;
            }
            Long id = b.id();
            if (id == null) errors.add(missing("id", null));
            if (b.brand() == null || b.brand().isBlank()) errors.add(missing("brand", id));
            if (b.type() == null || b.type().isBlank()) {
                errors.add(missing("type", id));
            } else if (BicycleType.fromLabel(b.type()) == null) {
                errors.add(new ImportError("INVALID_TYPE", "Unknown bicycle type: " + b.type(), id));
            }
            if (b.status() == null || b.status().isBlank()) {
                errors.add(missing("status", id));
            } else if (AvailabilityStatus.fromLabel(b.status()) == null) {
                errors.add(new ImportError("INVALID_STATUS", "Unknown availability status: " + b.status(), id));
            }
            if (b.price() == null) {
                errors.add(missing("price", id));
            } else if (!(b.price() >= 0) || b.price().isInfinite()) {
                errors.add(new ImportError("NEGATIVE_PRICE", "Price must be a non-negative amount: " + b.price(), id));
            }
            if (b.conditionScore() == null) {
                errors.add(missing("conditionScore", id));
            } else if (outOfRange(b.conditionScore())) {
                errors.add(new ImportError("SCORE_OUT_OF_RANGE", "conditionScore outside [0,1]: " + b.conditionScore(), id));
            }
            if (b.popularityScore() != null && outOfRange(b.popularityScore())) {
                errors.add(new ImportError("SCORE_OUT_OF_RANGE", "popularityScore outside [0,1]: " + b.popularityScore(), id));
            }
        }

        Set<Long> known = new HashSet<>(storedIds);
        known.addAll(counts.keySet());
        for (RentalIn r : rentals) {
            if (r == null || r.bicycleId() == null) {
                errors.add(missing("bicycleId", null));
            } else if (!known.contains(r.bicycleId())) {
                errors.add(new ImportError("BICYCLE_NOT_FOUND", "Rental references unknown bicycle: " + r.bicycleId(), r.bicycleId()));
            }
        }
        return errors;
    }

    private ImportError missing(String field, Long id) {
        return new ImportError("MISSING_FIELD", "Missing " + field, id);
    }

    private boolean outOfRange(double v) {
        return !(v >= 0.0 && v <= 1.0);
    }
}
