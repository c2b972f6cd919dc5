package com.example.supplymatch.domain.catalog;

import com.example.supplymatch.domain.model.CatalogItem;
import com.example.supplymatch.domain.model.Supplier;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable view of the catalog as fetched at {@code fetchedAt}, with the exclusion set and the
 * pool of items that may be offered as matches computed once up front.
 */
public final class CatalogSnapshot {

    private final List<CatalogItem> items;
    private final Set<String> excludedIds;
    private final List<CatalogItem> searchableItems;
    private final List<Supplier> suppliers;
    private final Map<String, CatalogItem> itemsById;
    private final Set<String> searchableIds;
    private final Instant fetchedAt;

    private CatalogSnapshot(List<CatalogItem> items, Set<String> excludedIds, List<Supplier> suppliers, Instant fetchedAt) {
        this.items = List.copyOf(items);
        this.excludedIds = Set.copyOf(excludedIds);
        this.suppliers = List.copyOf(suppliers);
        this.fetchedAt = fetchedAt;
        Map<String, CatalogItem> byId = new LinkedHashMap<>();
        for (CatalogItem item : this.items) {
            byId.putIfAbsent(item.id(), item);
        }
        this.itemsById = byId;
        this.searchableItems = this.items.stream()
                .filter(item -> !item.isGroup())
                .filter(item -> !this.excludedIds.contains(item.id()))
                .filter(item -> item.name() != null && !item.name().isBlank())
                .toList();
        this.searchableIds = this.searchableItems.stream()
                .map(CatalogItem::id)
                .collect(Collectors.toUnmodifiableSet());
    }

    public static CatalogSnapshot of(List<CatalogItem> items, List<Supplier> suppliers,
                                     CatalogExclusionBuilder exclusionBuilder, Instant fetchedAt) {
        List<CatalogItem> safeItems = items == null ? List.of() : items;
        return new CatalogSnapshot(safeItems, exclusionBuilder.buildExclusions(safeItems),
                suppliers == null ? List.of() : suppliers, fetchedAt);
    }

    public static CatalogSnapshot empty() {
        return new CatalogSnapshot(List.of(), Set.of(), List.of(), Instant.EPOCH);
    }

    public List<CatalogItem> items() {
        return items;
    }

    public Set<String> excludedIds() {
        return excludedIds;
    }

    public List<CatalogItem> searchableItems() {
        return searchableItems;
    }

    public List<Supplier> suppliers() {
        return suppliers;
    }

    public Instant fetchedAt() {
        return fetchedAt;
    }

    public Optional<CatalogItem> findItem(String id) {
        return Optional.ofNullable(id == null ? null : itemsById.get(id));
    }

    public boolean isExcluded(String id) {
        return excludedIds.contains(id);
    }

    /**
     * @return {@code true} when the id names an item that may be offered as a match
     */
    public boolean isSearchable(String id) {
        return id != null && searchableIds.contains(id);
    }
}
