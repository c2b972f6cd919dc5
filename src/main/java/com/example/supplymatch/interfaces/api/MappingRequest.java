package com.example.supplymatch.interfaces.api;

/**
 * Body of a mapping confirmation: the invoice line text and the catalog item chosen for it.
 */
public record MappingRequest(String lineText, String catalogItemId) {
}
