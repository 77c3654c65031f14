package com.products.lookup.config;

import com.products.lookup.model.ProductType;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;

/**
 * Holds configuration properties for one product catalog service.
 * <p>
 * Each instance encapsulates the endpoint, the product type it serves and the
 * client-side protection applied to it.
 * </p>
 */
@Getter
@Setter
public class CatalogCfg {

    /**
     * The base URL to which the product path is relative.
     * <p>For example, "https://world.openfoodfacts.org".</p>
     */
    private String baseUrl;

    /**
     * Product path template, {@code {barcode}} is expanded.
     * <p>For example, "/api/v2/product/{barcode}".</p>
     */
    private String productPath = "/api/v2/product/{barcode}";

    /**
     * Comma separated list of fields requested from the catalog.
     */
    private String fields = "code,product_name,product_name_{lc},generic_name,generic_name_{lc},brands,"
            + "ingredients_text,ingredients_text_{lc},allergens,allergens_tags,traces,nutriscore_grade,"
            + "nova_group,periods_after_opening,product_type,image_front_url,image_url,"
            + "image_ingredients_url,image_nutrition_url";

    /**
     * Type tag given to records resolved from this catalog.
     */
    private ProductType productType = ProductType.FOOD;

    /**
     * Value the catalog's {@code product_type} field must carry; {@code null} accepts anything.
     */
    private String expectedProductType;

    /**
     * Whether the catalog bean should be active
     */
    private boolean enabled = true;

    /**
     * Timeout for one product fetch
     */
    private Duration timeout = Duration.ofSeconds(10);

    /**
     * Simple client-side rate limiting
     */
    private RateLimit rateLimit = new RateLimit();

    @Data
    public static class RateLimit {

        /** Allowed number of HTTP requests per second */
        private int permitsPerSecond = 5;

        /** How long a caller may wait for a permit before the call fails */
        private Duration maxWait = Duration.ofSeconds(2);
    }
}
