package com.products.lookup.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.products.lookup.model.Language;
import com.products.lookup.model.ProductRecord;
import com.products.lookup.model.ProductType;

/**
 * Converts the {@code product} object of a catalog answer into a {@link ProductRecord}.
 */
@FunctionalInterface
public interface ProductJsonParser {

    /**
     * @param barcode  barcode that was looked up
     * @param product  the {@code product} object of the catalog envelope
     * @param type     product type of the catalog that answered
     * @param language language the catalog was asked for
     * @return the mapped record, never {@code null}; the retrieval instant is left unset
     */
    ProductRecord parse(String barcode, JsonNode product, ProductType type, Language language);
}
