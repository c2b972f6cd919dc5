package com.example.supplymatch.domain.model;

import java.util.List;

/**
 * Result of reading one invoice document: the extracted line items and, when it could be
 * located, the supplier name printed on the document.
 */
public record ParsedDocument(
        String fileName,
        DocumentFormat format,
        List<LineItem> lineItems,
        String supplierName
) {

    public ParsedDocument {
        lineItems = lineItems == null ? List.of() : List.copyOf(lineItems);
    }

    public boolean isEmpty() {
        return lineItems.isEmpty();
    }
}
