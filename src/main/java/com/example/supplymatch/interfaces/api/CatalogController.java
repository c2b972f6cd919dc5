package com.example.supplymatch.interfaces.api;

import com.example.supplymatch.application.service.CatalogSnapshotService;
import com.example.supplymatch.application.service.ReconciliationService;
import com.example.supplymatch.domain.catalog.CatalogSnapshot;
import com.example.supplymatch.domain.model.MatchCandidate;
import com.example.supplymatch.domain.model.Supplier;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Catalog search, snapshot refresh and supplier lookup.
 */
@RestController
@RequestMapping(value = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
public class CatalogController {

    private final ReconciliationService reconciliationService;
    private final CatalogSnapshotService catalogSnapshotService;

    public CatalogController(ReconciliationService reconciliationService, CatalogSnapshotService catalogSnapshotService) {
        this.reconciliationService = reconciliationService;
        this.catalogSnapshotService = catalogSnapshotService;
    }

    @GetMapping("/catalog/search")
    public List<MatchCandidate> search(@RequestParam("q") String query,
                                       @RequestParam(value = "limit", required = false) Integer limit,
                                       @RequestParam(value = "minScore", required = false) Integer minScore) {
        return reconciliationService.searchCatalog(query, limit, minScore);
    }

    @PostMapping("/catalog/refresh")
    public CatalogRefreshResponse refresh() {
        CatalogSnapshot snapshot = catalogSnapshotService.refresh();
        return new CatalogRefreshResponse(snapshot.items().size(), snapshot.excludedIds().size(),
                snapshot.searchableItems().size(), snapshot.suppliers().size(), snapshot.fetchedAt());
    }

    /**
     * @return the best matching supplier, or 204 when none scores high enough
     */
    @GetMapping("/suppliers/match")
    public ResponseEntity<Supplier> matchSupplier(@RequestParam("name") String name) {
        return reconciliationService.matchSupplier(name)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
