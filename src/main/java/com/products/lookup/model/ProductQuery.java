package com.products.lookup.model;

/**
 * Input of a product resolution.
 *
 * @param barcode        product code to look up
 * @param includePricing whether price enrichment is wanted
 * @param location       optional store location name used to narrow prices
 * @param productType    catalog to resolve against, {@link ProductType#FOOD} when {@code null}
 */
public record ProductQuery(String barcode, boolean includePricing, String location, ProductType productType) {

    public ProductQuery {
        productType = productType == null ? ProductType.FOOD : productType;
    }

    public static ProductQuery of(final String barcode) {
        return new ProductQuery(barcode, true, null, ProductType.FOOD);
    }

    public static ProductQuery basic(final String barcode) {
        return new ProductQuery(barcode, false, null, ProductType.FOOD);
    }

    public ProductQuery withLocation(final String newLocation) {
        return new ProductQuery(barcode, includePricing, newLocation, productType);
    }
}
