package com.products.lookup.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binds catalog-specific configuration from <code>application.yml</code>
 * under the <code>catalogs</code> prefix. Each entry in the bound map
 * corresponds to a {@link CatalogCfg} object keyed by the catalog identifier.
 * <p>
 * Example YAML:
 * <pre>{@code
 * catalogs:
 *   configs:
 *     food:
 *       base-url: https://world.openfoodfacts.org
 *       product-type: food
 *     beauty:
 *       base-url: https://world.openbeautyfacts.org
 *       product-type: beauty
 *       expected-product-type: beauty
 * }</pre>
 */
@Component
@ConfigurationProperties(prefix = "catalogs")
@Getter
@Setter
public class CatalogProperties {

    /**
     * Map of catalog identifiers to their corresponding {@link CatalogCfg}
     * instances, preserving insertion order.
     */
    private final Map<String, CatalogCfg> configs = new LinkedHashMap<>();

    /**
     * Retrieves the {@link CatalogCfg} for the given catalog name.
     *
     * @param name the catalog identifier
     * @return the {@link CatalogCfg} associated with {@code name}, or {@code null}
     * if no such catalog is configured
     */
    public CatalogCfg forName(final String name) {
        return configs.get(name);
    }
}
