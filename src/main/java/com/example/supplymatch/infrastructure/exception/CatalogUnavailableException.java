package com.example.supplymatch.infrastructure.exception;

/**
 * Raised when the catalog provider cannot deliver the product list or the suppliers.
 * This is the one failure callers are expected to act on, typically by retrying later.
 */
public class CatalogUnavailableException extends InfrastructureException {

    public CatalogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public CatalogUnavailableException(String message) {
        super(message, null);
    }
}
