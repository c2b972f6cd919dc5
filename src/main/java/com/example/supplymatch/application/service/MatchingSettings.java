package com.example.supplymatch.application.service;

/**
 * Default search parameters used when a caller does not supply its own.
 *
 * @param limit    maximum number of candidates returned by a search
 * @param minScore lowest score a candidate may have
 */
public record MatchingSettings(int limit, int minScore) {

    public MatchingSettings {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        if (minScore < 0 || minScore > 100) {
            throw new IllegalArgumentException("minScore must be between 0 and 100");
        }
    }
}
