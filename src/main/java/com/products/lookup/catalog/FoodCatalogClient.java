package com.products.lookup.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.products.lookup.config.CatalogConfigFactory;
import com.products.lookup.parser.ProductJsonParser;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

/**
 * Catalog of food products (Open Food Facts).
 */
@Service("foodCatalog")
@ConditionalOnProperty(prefix = "catalogs.configs.food", name = "enabled",
        havingValue = "true", matchIfMissing = true)
public class FoodCatalogClient extends CatalogSearchEngine {

    public FoodCatalogClient(@Qualifier("openFactsParser") final ProductJsonParser parser,
                             final CatalogConfigFactory factory,
                             final WebClient.Builder builder,
                             @Qualifier("lookupObjectMapper") final ObjectMapper om,
                             final CircuitBreakerRegistry breakers,
                             final RateLimiterRegistry limiters,
                             final Clock clock) {
        super("food", factory.forCatalog("food"), builder, parser, om, breakers, limiters, clock);
    }
}
