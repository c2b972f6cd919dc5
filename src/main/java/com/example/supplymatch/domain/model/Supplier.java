package com.example.supplymatch.domain.model;

/**
 * Counterparty known to the catalog system.
 */
public record Supplier(String id, String name) {
}
