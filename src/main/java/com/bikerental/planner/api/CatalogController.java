package com.bikerental.planner.api;

import com.bikerental.planner.catalog.CatalogImportModels.ImportRequest;
import com.bikerental.planner.catalog.CatalogImportModels.ImportResult;
import com.bikerental.planner.catalog.CatalogReader;
import com.bikerental.planner.domain.DomainModels.BicycleRecord;
import com.bikerental.planner.service.CatalogImportService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/catalog")
public class CatalogController {
    private final CatalogImportService importService;
    private final CatalogReader catalogReader;

    public CatalogController(CatalogImportService importService, CatalogReader catalogReader) {
        this.importService = importService;
        this.catalogReader = catalogReader;
    }

    @PostMapping("/import")
    public ResponseEntity<ImportResult> importCatalog(@RequestBody ImportRequest request) {
        return ResponseEntity.ok(importService.importCatalog(request));
    }

    @GetMapping
    public ResponseEntity<List<BicycleRecord>> catalog() {
        return ResponseEntity.ok(catalogReader.snapshot());
    }
}
