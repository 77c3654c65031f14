package com.products.lookup.model;

/**
 * Kind of catalog a product record was resolved from.
 */
public enum ProductType {

    FOOD("Food Product"),
    BEAUTY("Beauty/Cosmetic Product"),
    GENERAL("General Product");

    private final String displayName;

    ProductType(final String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
