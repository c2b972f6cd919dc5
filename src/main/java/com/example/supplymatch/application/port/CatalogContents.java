package com.example.supplymatch.application.port;

import com.example.supplymatch.domain.model.CatalogItem;
import com.example.supplymatch.domain.model.Supplier;

import java.util.List;

/**
 * Catalog entries and suppliers taken from the same read of the catalog source.
 */
public record CatalogContents(List<CatalogItem> items, List<Supplier> suppliers) {

    public CatalogContents {
        items = items == null ? List.of() : List.copyOf(items);
        suppliers = suppliers == null ? List.of() : List.copyOf(suppliers);
    }
}
