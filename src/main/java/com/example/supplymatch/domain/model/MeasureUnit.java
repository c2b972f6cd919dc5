package com.example.supplymatch.domain.model;

/**
 * Normalized unit of measure for invoice lines. Anything that is not recognizably weight or
 * volume is counted in pieces.
 */
public enum MeasureUnit {
    KG,
    PIECE,
    LITER
}
