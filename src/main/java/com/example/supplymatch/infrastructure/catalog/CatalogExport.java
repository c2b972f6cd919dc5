package com.example.supplymatch.infrastructure.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Shape of the catalog export file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record CatalogExport(List<ProductEntry> products, List<SupplierEntry> suppliers) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ProductEntry(String id, String parentId, String name, String productType, String num, String code) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SupplierEntry(String id, String name) {
    }
}
