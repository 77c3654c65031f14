package com.products.lookup.cache;

import com.products.lookup.model.ProductRecord;
import com.products.lookup.model.ProductType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Product cache that keeps nothing: every lookup misses and writes are dropped.
 */
@Slf4j
@Component
public class NoOpProductCache implements ProductCache {

    public NoOpProductCache() {
        log.info("No product cache store configured, using no-op product cache");
    }

    @Override
    public Mono<ProductRecord> find(final String barcode, final ProductType type) {
        return Mono.empty();
    }

    @Override
    public Mono<Void> store(final ProductRecord product) {
        return Mono.empty();
    }

    @Override
    public Mono<Void> clear() {
        return Mono.empty();
    }

    @Override
    public Map<String, Object> stats() {
        return Map.of("type", "noop", "entries", 0);
    }
}
