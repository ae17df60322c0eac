package com.example.acr.catalog;

/**
 * The criterion catalog resource is missing or inconsistent. Raised at startup only.
 */
public class CatalogLoadException extends RuntimeException {

    public CatalogLoadException(String message) {
        super(message);
    }

    public CatalogLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
