package com.example.supplymatch.domain.model;

/**
 * Catalog entry as supplied by the external catalog provider.
 * The core only reads and filters these; {@code code} and {@code parentId} are empty strings when absent.
 */
public record CatalogItem(
        String id,
        String name,
        String code,
        CatalogItemType type,
        String parentId
) {

    public CatalogItem {
        code = code == null ? "" : code.trim();
        parentId = parentId == null ? "" : parentId.trim();
        type = type == null ? CatalogItemType.UNSPECIFIED : type;
    }

    public boolean isGroup() {
        return type == CatalogItemType.GROUP;
    }
}
