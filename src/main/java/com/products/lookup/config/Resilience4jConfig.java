package com.products.lookup.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * <h2>Resilience4j Configuration</h2>
 *
 * <p>
 * Exposes the Resilience4j registries used by the catalog clients. Each catalog
 * pulls a {@link CircuitBreaker} and a {@link RateLimiter} named after itself
 * (see {@code CatalogSearchEngine}). Catalog calls are never retried; a
 * failed call falls through to the next language.
 * </p>
 */
@Configuration
public class Resilience4jConfig {

    /**
     * Creates the global {@link CircuitBreakerRegistry}.
     * <p>
     * A catalog breaker opens when half of the last 20 calls failed and stays
     * open for 30 seconds.
     * </p>
     *
     * @return the registry holding every catalog breaker
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowSize(20)
                .minimumNumberOfCalls(10)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .build();
        return CircuitBreakerRegistry.of(config);
    }

    /**
     * Creates the global {@link RateLimiterRegistry}; catalog limiters are
     * registered with their own configuration from {@link CatalogCfg}.
     *
     * @return a registry pre-populated with default rate-limiter configuration
     */
    @Bean
    public RateLimiterRegistry rateLimiterRegistry() {
        return RateLimiterRegistry.ofDefaults();
    }
}
