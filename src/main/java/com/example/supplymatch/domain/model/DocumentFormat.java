package com.example.supplymatch.domain.model;

/**
 * Source format of an uploaded invoice.
 */
public enum DocumentFormat {
    PDF,
    SPREADSHEET
}
