package com.example.supplymatch.domain.exception;

/**
 * Raised when a caller references a catalog id that is not part of the current snapshot.
 */
public class CatalogItemNotFoundException extends DomainException {

    public CatalogItemNotFoundException(String catalogItemId) {
        super("Catalog item not found: " + catalogItemId);
    }
}
