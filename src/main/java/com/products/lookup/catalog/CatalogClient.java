package com.products.lookup.catalog;

import com.products.lookup.model.Language;
import com.products.lookup.model.ProductRecord;
import com.products.lookup.model.ProductType;
import reactor.core.publisher.Mono;

/**
 * A product catalog able to describe a barcode in a given language.
 */
public interface CatalogClient {

    /**
     * @return the product type records from this catalog are tagged with
     */
    ProductType productType();

    /**
     * Looks one barcode up in one language.
     *
     * @param barcode  validated barcode
     * @param language requested language
     * @return the product; empty when the catalog does not know it, an error
     *         signal ({@link CatalogException} or a resilience rejection) when
     *         the catalog could not answer
     */
    Mono<ProductRecord> fetchProduct(String barcode, Language language);
}
