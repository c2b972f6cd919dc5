package com.example.supplymatch.domain.model;

import java.util.Locale;
import java.util.Set;

/**
 * Kind of catalog entry. Groups are categories and can never be the target of a supply line.
 * {@link #UNSPECIFIED} covers entries the provider sent without a type; they may act as categories
 * when computing exclusions but stay searchable.
 */
public enum CatalogItemType {
    ITEM,
    GROUP,
    UNSPECIFIED;

    private static final Set<String> GROUP_TYPES = Set.of("products", "productgroup", "group");

    /**
     * Maps the provider's raw type string onto the enum.
     *
     * @param rawType type string as exported by the catalog (may be {@code null})
     * @return matching type, {@link #UNSPECIFIED} when blank
     */
    public static CatalogItemType fromRaw(String rawType) {
        if (rawType == null || rawType.isBlank()) {
            return UNSPECIFIED;
        }
        return GROUP_TYPES.contains(rawType.trim().toLowerCase(Locale.ROOT)) ? GROUP : ITEM;
    }
}
