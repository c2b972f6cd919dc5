package com.example.supplymatch.interfaces.api;

import java.time.Instant;

/**
 * Summary of a freshly loaded catalog snapshot.
 */
public record CatalogRefreshResponse(
        int items,
        int excluded,
        int searchable,
        int suppliers,
        Instant fetchedAt
) {
}
