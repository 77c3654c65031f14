package com.products.lookup.catalog;

import com.products.lookup.model.ProductType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of the active catalogs, keyed by the product type they serve.
 * Catalogs switched off in configuration are simply absent.
 */
@Slf4j
@Component
public class CatalogRegistry {

    private final Map<ProductType, CatalogClient> byType;

    public CatalogRegistry(final List<CatalogClient> catalogs) {
        Map<ProductType, CatalogClient> map = new EnumMap<>(ProductType.class);
        for (CatalogClient catalog : catalogs) {
            CatalogClient previous = map.putIfAbsent(catalog.productType(), catalog);
            if (previous != null) {
                log.warn("Two catalogs serve {}, keeping {}", catalog.productType(), previous.getClass().getSimpleName());
            }
        }
        this.byType = Collections.unmodifiableMap(map);
        log.info("Registered product catalogs: {}", byType.keySet());
    }

    public Optional<CatalogClient> find(final ProductType type) {
        return Optional.ofNullable(byType.get(type));
    }

    public Set<ProductType> supportedTypes() {
        return byType.keySet();
    }
}
