package com.example.supplymatch.application.service;

import com.example.supplymatch.application.port.CatalogContents;
import com.example.supplymatch.application.port.CatalogProvider;
import com.example.supplymatch.domain.catalog.CatalogExclusionBuilder;
import com.example.supplymatch.domain.catalog.CatalogSnapshot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current {@link CatalogSnapshot}. The catalog is fetched on first use and afterwards
 * only when {@link #refresh()} is called; a refresh replaces the snapshot as a whole, so readers
 * always see one consistent catalog.
 */
@Service
public class CatalogSnapshotService {

    private static final Logger log = LoggerFactory.getLogger(CatalogSnapshotService.class);

    private final CatalogProvider catalogProvider;
    private final CatalogExclusionBuilder exclusionBuilder;
    private final Clock clock;
    private final AtomicReference<CatalogSnapshot> current = new AtomicReference<>();

    public CatalogSnapshotService(CatalogProvider catalogProvider, CatalogExclusionBuilder exclusionBuilder, Clock clock) {
        this.catalogProvider = catalogProvider;
        this.exclusionBuilder = exclusionBuilder;
        this.clock = clock;
    }

    /**
     * @return the cached snapshot, fetching it first if nothing has been loaded yet
     * @throws com.example.supplymatch.infrastructure.exception.CatalogUnavailableException when the first fetch fails
     */
    public CatalogSnapshot current() {
        CatalogSnapshot snapshot = current.get();
        if (snapshot != null) {
            return snapshot;
        }
        synchronized (this) {
            snapshot = current.get();
            if (snapshot == null) {
                snapshot = load();
                current.set(snapshot);
            }
            return snapshot;
        }
    }

    /**
     * Fetches the catalog again and publishes the new snapshot. On failure the previous snapshot
     * stays in place and the exception propagates.
     *
     * @return the new snapshot
     */
    public synchronized CatalogSnapshot refresh() {
        CatalogSnapshot snapshot = load();
        current.set(snapshot);
        return snapshot;
    }

    private CatalogSnapshot load() {
        CatalogContents contents = catalogProvider.fetchAll();
        CatalogSnapshot snapshot = CatalogSnapshot.of(contents.items(), contents.suppliers(), exclusionBuilder,
                Instant.now(clock));
        log.info("Loaded catalog snapshot: {} entries, {} excluded, {} searchable, {} suppliers",
                snapshot.items().size(), snapshot.excludedIds().size(),
                snapshot.searchableItems().size(), snapshot.suppliers().size());
        return snapshot;
    }
}
