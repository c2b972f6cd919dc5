package com.example.supplymatch.domain.model;

import java.math.BigDecimal;

/**
 * Domain DTO describing one product row extracted from an invoice table.
 * Quantity is always strictly positive; rows that fail this check never become line items.
 */
public record LineItem(
        String name,
        MeasureUnit unit,
        BigDecimal quantity,
        BigDecimal unitPriceWithTax,
        String sourceCode
) {

    public LineItem {
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("quantity must be positive: " + quantity);
        }
    }
}
