package com.example.supplymatch.application.port;

import com.example.supplymatch.domain.model.CatalogItem;
import com.example.supplymatch.domain.model.Supplier;

import java.util.List;

/**
 * Source of the external product catalog and supplier list.
 * Each call returns a complete list; implementations throw
 * {@link com.example.supplymatch.infrastructure.exception.CatalogUnavailableException} when the
 * source cannot be read.
 */
public interface CatalogProvider {

    List<CatalogItem> fetchCatalog();

    List<Supplier> fetchSuppliers();

    /**
     * Fetches entries and suppliers together. Implementations backed by a single export override
     * this to read it once, so both lists come from the same version.
     */
    default CatalogContents fetchAll() {
        return new CatalogContents(fetchCatalog(), fetchSuppliers());
    }
}
