package com.example.supplymatch.domain.model;

import java.util.Optional;

/**
 * Proposed catalog item for a single invoice line. {@code lineIndex} is 1-based, matching the
 * numbering shown to the person confirming the document.
 */
public record LineMatch(
        int lineIndex,
        LineItem lineItem,
        MatchCandidate candidate,
        MatchSource source
) {

    public Optional<MatchCandidate> match() {
        return Optional.ofNullable(candidate);
    }
}
