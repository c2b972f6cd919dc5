package com.example.supplymatch.domain.exception;

/**
 * Raised when a mapping would point an invoice line at something that cannot receive stock:
 * a category group, or an item hidden by the exclusion rules.
 */
public class InvalidMatchTargetException extends DomainException {

    private final String catalogItemId;

    public InvalidMatchTargetException(String catalogItemId, String message) {
        super(message);
        this.catalogItemId = catalogItemId;
    }

    /**
     * Factory for the common case of a category picked instead of a concrete product.
     *
     * @param catalogItemId id of the offending group
     * @param name          display name of the group
     * @return exception with a user facing explanation
     */
    public static InvalidMatchTargetException group(String catalogItemId, String name) {
        return new InvalidMatchTargetException(catalogItemId,
                "«" + name + "» is a category, not a product. Pick a concrete item inside it.");
    }

    public static InvalidMatchTargetException excluded(String catalogItemId, String name) {
        return new InvalidMatchTargetException(catalogItemId,
                "«" + name + "» belongs to an excluded catalog folder and cannot be used for supplies.");
    }

    public String getCatalogItemId() {
        return catalogItemId;
    }
}
