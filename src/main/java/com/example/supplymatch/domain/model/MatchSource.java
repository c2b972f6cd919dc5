package com.example.supplymatch.domain.model;

/**
 * Where a line's proposed catalog item came from.
 */
public enum MatchSource {
    LEARNED,
    SEARCH,
    NONE
}
