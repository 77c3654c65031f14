package com.products.lookup.catalog;

/**
 * Signals that a catalog could not answer: transport error, unexpected HTTP
 * status or unreadable payload. "Not found" is never reported this way.
 */
public class CatalogException extends RuntimeException {

    private final String catalog;

    public CatalogException(final String catalog, final String message) {
        super(message);
        this.catalog = catalog;
    }

    public CatalogException(final String catalog, final String message, final Throwable cause) {
        super(message, cause);
        this.catalog = catalog;
    }

    public String getCatalog() {
        return catalog;
    }
}
