package com.products.lookup.cache;

import com.products.lookup.model.ProductRecord;
import com.products.lookup.model.ProductType;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Store of previously resolved products, keyed by barcode and product type.
 */
public interface ProductCache {

    /**
     * @return the cached record regardless of its age; empty when absent
     */
    Mono<ProductRecord> find(String barcode, ProductType type);

    /**
     * Stores or replaces the record for its barcode and type.
     */
    Mono<Void> store(ProductRecord product);

    Mono<Void> clear();

    /**
     * @return implementation-specific counters, never {@code null}
     */
    Map<String, Object> stats();
}
