package com.products.lookup.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the pricing service.
 *
 * <p>Values are bound from properties prefixed with {@code pricing} (application.yml,
 * or a {@code .env} file through {@link DotenvEnvironmentPostProcessor}).</p>
 *
 * <p>Example application.yml snippet:
 * <pre>
 * pricing:
 *   enabled: true
 *   base-url: https://prices.openfoodfacts.org/api/v1
 *   session-url: https://world.openfoodfacts.org/cgi/session.pl
 *   credentials:
 *     file: open_prices_credentials.json
 *     manual-token: ${OPEN_PRICES_TOKEN:}
 * </pre>
 * </p>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "pricing")
public class PricingProperties {

    /** Administrative switch: when off, every pricing operation answers empty. */
    private boolean enabled = true;

    /** Base URL all pricing paths are relative to. */
    @NotBlank
    private String baseUrl = "https://prices.openfoodfacts.org/api/v1";

    /** Absolute URL of the form-encoded login exchange. */
    @NotBlank
    private String sessionUrl = "https://world.openfoodfacts.org/cgi/session.pl";

    /** User-Agent sent on every pricing request. */
    @NotBlank
    private String userAgent = "ProductLookup/1.0";

    /** Age, in days, of the oldest price considered "recent". */
    @Min(1)
    private int recentWindowDays = 30;

    /** Maximum number of prices fetched for the recent window attached to products. */
    @Min(1)
    private int recentWindowSize = 30;

    /** Maximum number of prices fetched when computing standalone statistics. */
    @Min(1)
    private int statsWindowSize = 100;

    /** Default page size of history, search and location queries. */
    @Min(1)
    private int defaultPageSize = 20;

    @Valid
    private Credentials credentials = new Credentials();

    /**
     * Where pricing credentials come from.
     */
    @Data
    public static class Credentials {

        /** Name of the JSON credential document. */
        @NotBlank
        private String file = "open_prices_credentials.json";

        /** Look in {@code src/test/resources} before anything else. */
        private boolean searchTestResources = true;

        /** File whose presence marks the project root during the upward scan. */
        @NotBlank
        private String markerFile = "pom.xml";

        /** Token applied when the credential document does not authenticate. */
        private String manualToken;
    }
}
