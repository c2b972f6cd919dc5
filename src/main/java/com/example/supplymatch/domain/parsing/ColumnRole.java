package com.example.supplymatch.domain.parsing;

/**
 * Logical columns of an invoice product table.
 */
public enum ColumnRole {
    ROW_NUMBER,
    NAME,
    CODE,
    UNIT,
    QUANTITY,
    UNIT_PRICE,
    TOTAL_WITH_TAX
}
