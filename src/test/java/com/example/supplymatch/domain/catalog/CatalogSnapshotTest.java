package com.example.supplymatch.domain.catalog;

import com.example.supplymatch.domain.model.CatalogItem;
import com.example.supplymatch.domain.model.CatalogItemType;
import com.example.supplymatch.domain.model.Supplier;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CatalogSnapshotTest {

    @Test
    void searchablePoolSkipsGroupsExcludedAndUnnamedItems() {
        List<CatalogItem> items = List.of(
                new CatalogItem("kitchen", "Кухня", "", CatalogItemType.GROUP, ""),
                new CatalogItem("soup", "Суп дня", "100", CatalogItemType.ITEM, "kitchen"),
                new CatalogItem("dairy", "Молочка", "", CatalogItemType.GROUP, ""),
                new CatalogItem("milk", "Молоко", "00375", CatalogItemType.ITEM, "dairy"),
                new CatalogItem("blank", " ", "200", CatalogItemType.ITEM, "dairy"));

        CatalogSnapshot snapshot = CatalogSnapshot.of(items, List.of(new Supplier("s1", "Ромашка")),
                new CatalogExclusionBuilder(ExclusionRules.defaults()), Instant.parse("2024-03-01T10:00:00Z"));

        assertThat(snapshot.searchableItems()).extracting(CatalogItem::id).containsExactly("milk");
        assertThat(snapshot.excludedIds()).containsExactlyInAnyOrder("kitchen", "soup");
        assertThat(snapshot.isSearchable("milk")).isTrue();
        assertThat(snapshot.isSearchable("soup")).isFalse();
        assertThat(snapshot.isSearchable("dairy")).isFalse();
        assertThat(snapshot.isSearchable("blank")).isFalse();
        assertThat(snapshot.findItem("soup")).isPresent();
        assertThat(snapshot.findItem("missing")).isEmpty();
        assertThat(snapshot.suppliers()).hasSize(1);
        assertThat(snapshot.fetchedAt()).isEqualTo(Instant.parse("2024-03-01T10:00:00Z"));
    }

    @Test
    void emptySnapshotHasNothingToOffer() {
        CatalogSnapshot snapshot = CatalogSnapshot.empty();

        assertThat(snapshot.items()).isEmpty();
        assertThat(snapshot.searchableItems()).isEmpty();
        assertThat(snapshot.isSearchable(null)).isFalse();
    }
}
