package com.bikerental.planner;

import com.bikerental.planner.catalog.CatalogImportModels.BicycleIn;
import com.bikerental.planner.catalog.CatalogImportModels.ImportRequest;
import com.bikerental.planner.catalog.CatalogImportModels.RentalIn;
import com.bikerental.planner.domain.DomainModels.AvailabilityStatus;
import com.bikerental.planner.domain.DomainModels.BicycleRecord;
import com.bikerental.planner.domain.DomainModels.BicycleType;
import com.bikerental.planner.repository.CatalogJdbcRepository;
import com.bikerental.planner.service.CatalogImportService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class CatalogImportServiceTest {
    @Autowired
    private CatalogImportService importService;
    @Autowired
    private CatalogJdbcRepository repository;

    private final List<BicycleIn> bicycles = List.of(
            new BicycleIn(1L, "Trek", "Mountain Bike", "L", 450.0, 0.8, null, "Available"),
            new BicycleIn(2L, "Giant", "Road Bike", "56cm", 380.0, 0.6, null, "Available"),
            new BicycleIn(3L, "Brompton", "City Bike", "M", 520.0, 0.9, 0.3, "Under maintenance"),
            new BicycleIn(4L, "Raleigh", "Hybrid Bike", "S", 210.0, 0.4, null, "AVAILABLE"));

    private final List<RentalIn> rentals = List.of(
            new RentalIn(1L, "2024-03-01", "2024-03-02", 10L),
            new RentalIn(1L, "2024-03-05", "2024-03-07", 11L),
            new RentalIn(1L, "2024-04-01", "2024-04-03", 12L),
            new RentalIn(1L, "2024-05-01", "2024-05-02", 10L),
            new RentalIn(2L, "2024-03-10", "2024-03-11", 13L),
            new RentalIn(2L, "2024-06-01", null, 14L));

    @Test
    void importsCatalogAndDerivesStatusAndPopularityFromRentals() {
        var result = importService.importCatalog(new ImportRequest(bicycles, rentals, false, true));
        assertTrue(result.valid());
        assertEquals(4, result.bicycleCount());
        assertEquals(6, result.rentalCount());

        Map<Long, BicycleRecord> byId = repository.snapshot().stream()
                .collect(Collectors.toMap(BicycleRecord::id, Function.identity()));
        assertEquals(4, byId.size());

        assertEquals(BicycleType.MOUNTAIN, byId.get(1L).type());
        assertEquals(AvailabilityStatus.AVAILABLE, byId.get(1L).status());
        assertEquals(1.0, byId.get(1L).popularityScore(), 1e-9);

        // open rental without a return date
        assertEquals(AvailabilityStatus.RENTED, byId.get(2L).status());
        assertEquals(0.5, byId.get(2L).popularityScore(), 1e-9);
        assertEquals("56", byId.get(2L).frameSize());

        assertEquals(AvailabilityStatus.OUT_OF_SERVICE, byId.get(3L).status());
        assertEquals(0.3, byId.get(3L).popularityScore(), 1e-9);

        assertEquals(0.0, byId.get(4L).popularityScore(), 1e-9);
    }

    @Test
    void reportsStructuredErrorsAndKeepsExistingCatalog() {
        assertTrue(importService.importCatalog(new ImportRequest(bicycles, rentals, false, true)).valid());

        var result = importService.importCatalog(new ImportRequest(List.of(
                new BicycleIn(7L, "Cube", "Road", "M", -5.0, 0.5, null, "Available"),
                new BicycleIn(7L, "Cube", "Road", "M", 100.0, 1.5, null, "Available"),
                new BicycleIn(8L, " ", "Road", "M", 100.0, 0.5, -0.2, "Lost"),
                new BicycleIn(9L, "Santos", "Tandem", "L", 800.0, 0.5, null, "Available")
        ), List.of(new RentalIn(99L, "2024-01-01", null, 1L)), false, true));

        assertFalse(result.valid());
        var codes = result.errors().stream().map(e -> e.code()).toList();
        assertTrue(codes.contains("DUPLICATE_BICYCLE"));
        assertTrue(codes.contains("NEGATIVE_PRICE"));
        assertTrue(codes.contains("SCORE_OUT_OF_RANGE"));
        assertTrue(codes.contains("MISSING_FIELD"));
        assertTrue(codes.contains("INVALID_STATUS"));
        assertTrue(codes.contains("BICYCLE_NOT_FOUND"));
        assertTrue(result.errors().stream().anyMatch(e -> e.code().equals("INVALID_TYPE") && Long.valueOf(9L).equals(e.bicycleId())));
        assertTrue(result.errors().stream().anyMatch(e -> Long.valueOf(8L).equals(e.bicycleId())));

        assertEquals(4, repository.snapshot().size());
    }

    @Test
    void dryRunValidatesWithoutStoring() {
        assertTrue(importService.importCatalog(new ImportRequest(bicycles, List.of(), false, true)).valid());

        var result = importService.importCatalog(new ImportRequest(List.of(
                new BicycleIn(20L, "Cannondale", "Electric Bike", "XL", 1200.0, 1.0, 0.1, "Available")
        ), List.of(), true, false));

        assertTrue(result.valid());
        assertTrue(result.dryRun());
        assertTrue(repository.snapshot().stream().noneMatch(b -> b.id() == 20L));
    }

    @Test
    void mergesIntoExistingCatalogWhenNotReplacing() {
        assertTrue(importService.importCatalog(new ImportRequest(bicycles, List.of(), false, true)).valid());

        var result = importService.importCatalog(new ImportRequest(List.of(
                new BicycleIn(4L, "Raleigh", "Hybrid Bike", "S", 199.0, 0.5, 0.2, "Available"),
                new BicycleIn(5L, "Specialized", "Single Gear Bike", "M", 300.0, 0.7, 0.4, "Available")
        ), List.of(new RentalIn(1L, "2024-07-01", null, 3L)), false, false));

        assertTrue(result.valid());
        Map<Long, BicycleRecord> byId = repository.snapshot().stream()
                .collect(Collectors.toMap(BicycleRecord::id, Function.identity()));
        assertEquals(5, byId.size());
        assertEquals(199.0, byId.get(4L).price(), 1e-9);
        assertEquals(BicycleType.SINGLE_GEAR, byId.get(5L).type());
        assertEquals(AvailabilityStatus.RENTED, byId.get(1L).status());
    }
}
