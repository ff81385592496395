package com.bikerental.planner.service;

import com.bikerental.planner.catalog.CatalogImportModels.BicycleIn;
import com.bikerental.planner.catalog.CatalogImportModels.ImportError;
import com.bikerental.planner.catalog.CatalogImportModels.ImportRequest;
import com.bikerental.planner.catalog.CatalogImportModels.ImportResult;
import com.bikerental.planner.domain.DomainModels.AvailabilityStatus;
import com.bikerental.planner.domain.DomainModels.BicycleRecord;
import com.bikerental.planner.domain.DomainModels.BicycleType;
import com.bikerental.planner.repository.CatalogJdbcRepository;
import com.bikerental.planner.repository.CatalogJdbcRepository.RentalRow;
import com.bikerental.planner.validation.CatalogValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Service
public class CatalogImportService {
    private static final Logger log = LoggerFactory.getLogger(CatalogImportService.class);

    private final CatalogValidator validator;
    private final CatalogJdbcRepository repository;

    public CatalogImportService(CatalogValidator validator, CatalogJdbcRepository repository) {
        this.validator = validator;
        this.repository = repository;
    }

    @Transactional
    public ImportResult importCatalog(ImportRequest request) {
        List<BicycleIn> bicycles = request.bicycles() == null ? List.of() : request.bicycles();
        List<RentalRow> rentals = request.rentals() == null ? List.of() : request.rentals().stream()
                .filter(r -> r != null && r.bicycleId() != null)
                .map(r -> new RentalRow(r.bicycleId(), r.rentalDate(), r.returnDate(), r.memberId()))
                .toList();

        Set<Long> stored = request.replace() ? Set.of() : repository.existingIds();
        List<ImportError> errors = validator.validate(request, stored);
        if (!errors.isEmpty()) {
            log.warn("catalog.import rejected errors={} first={}", errors.size(), errors.get(0).code());
            return new ImportResult(request.dryRun(), false, bicycles.size(), rentals.size(), errors);
        }

        if (!request.dryRun()) {
            if (request.replace()) {
                repository.deleteAll();
            }
            repository.upsertBicycles(bicycles.stream().map(this::toRecord).toList(),
                    bicycles.stream().filter(b -> b.popularityScore() == null).map(BicycleIn::id).collect(Collectors.toSet()));
            repository.insertRentals(rentals);
        }
        log.info("catalog.import dryRun={} replace={} bicycles={} rentals={}",
                request.dryRun(), request.replace(), bicycles.size(), rentals.size());
        return new ImportResult(request.dryRun(), true, bicycles.size(), rentals.size(), List.of());
    }

    private BicycleRecord toRecord(BicycleIn b) {
        return new BicycleRecord(
                b.id(),
                b.brand().trim(),
                BicycleType.fromLabel(b.type()),
                b.frameSize(),
                b.price(),
                b.conditionScore(),
                b.popularityScore() == null ? 0.0 : b.popularityScore(),
                AvailabilityStatus.fromLabel(b.status()));
    }
}
