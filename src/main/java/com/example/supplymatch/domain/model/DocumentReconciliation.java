package com.example.supplymatch.domain.model;

import java.util.List;

/**
 * Parsed document together with the proposed catalog items for every line and the matched supplier.
 */
public record DocumentReconciliation(
        ParsedDocument document,
        List<LineMatch> lines,
        Supplier matchedSupplier
) {
}
