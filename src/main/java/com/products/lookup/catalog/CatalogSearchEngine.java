package com.products.lookup.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.products.lookup.config.CatalogCfg;
import com.products.lookup.model.Language;
import com.products.lookup.model.ProductRecord;
import com.products.lookup.model.ProductType;
import com.products.lookup.parser.ProductJsonParser;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

/**
 * <h2>CatalogSearchEngine</h2>
 *
 * <p>Shared plumbing of the product catalogs, which all speak the same
 * envelope:</p>
 * <pre>{@code
 * GET {base}/api/v2/product/{barcode}?lc={lang}&fields=...
 * {"status": 1, "status_verbose": "product found", "product": {...}}
 * }</pre>
 *
 * <p>Every call goes through a per-catalog Resilience4j rate limiter and
 * circuit breaker named {@code catalog-<key>}. HTTP 404, a failed status flag
 * and a {@code product_type} other than the configured one complete empty;
 * every other failure is an error signal.</p>
 */
@Slf4j
@Getter
public abstract class CatalogSearchEngine implements CatalogClient {

    private static final String LANGUAGE_PLACEHOLDER = "{lc}";

    private static final Duration RATE_LIMIT_PERIOD = Duration.ofSeconds(1);

    private final String key;

    private final CatalogCfg cfg;

    private final WebClient webClient;

    private final ProductJsonParser parser;

    private final ObjectMapper mapper;

    private final CircuitBreaker circuitBreaker;

    private final RateLimiter rateLimiter;

    private final Clock clock;

    protected CatalogSearchEngine(final String key,
                                  final CatalogCfg cfg,
                                  final WebClient.Builder builder,
                                  final ProductJsonParser parser,
                                  final ObjectMapper mapper,
                                  final CircuitBreakerRegistry breakers,
                                  final RateLimiterRegistry limiters,
                                  final Clock clock) {
        this.key = key;
        this.cfg = cfg;
        this.webClient = builder.clone().baseUrl(cfg.getBaseUrl()).build();
        this.parser = parser;
        this.mapper = mapper;
        this.circuitBreaker = breakers.circuitBreaker("catalog-" + key);
        this.rateLimiter = limiters.rateLimiter("catalog-" + key, RateLimiterConfig.custom()
                .limitForPeriod(cfg.getRateLimit().getPermitsPerSecond())
                .limitRefreshPeriod(RATE_LIMIT_PERIOD)
                .timeoutDuration(cfg.getRateLimit().getMaxWait())
                .build());
        this.clock = clock;
    }

    @Override
    public ProductType productType() {
        return cfg.getProductType();
    }

    @Override
    public Mono<ProductRecord> fetchProduct(final String barcode, final Language language) {
        String lc = language.getCode();
        String fields = cfg.getFields().replace(LANGUAGE_PLACEHOLDER, lc);

        return webClient.get()
                .uri(b -> b.path(cfg.getProductPath())
                        .queryParam("lc", lc)
                        .queryParam("fields", fields)
                        .build(barcode))
                .accept(MediaType.APPLICATION_JSON)
                .exchangeToMono(resp -> readEnvelope(resp, barcode))
                .timeout(cfg.getTimeout())
                .flatMap(envelope -> toRecord(envelope, barcode, language))
                .transformDeferred(RateLimiterOperator.of(rateLimiter))
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                .doOnNext(p -> log.debug("{} catalog resolved {} in {}", key, barcode, lc));
    }

    private Mono<JsonNode> readEnvelope(final ClientResponse resp, final String barcode) {
        int status = resp.statusCode().value();
        if (status == 404) {
            return resp.releaseBody().then(Mono.empty());
        }
        if (!resp.statusCode().is2xxSuccessful()) {
            return resp.releaseBody().then(Mono.error(
                    new CatalogException(key, "HTTP " + status + " for barcode " + barcode)));
        }
        return resp.bodyToMono(String.class)
                .filter(body -> !body.isBlank())
                .switchIfEmpty(Mono.error(() -> new CatalogException(key, "Empty answer for barcode " + barcode)))
                .flatMap(body -> {
                    try {
                        return Mono.just(mapper.readTree(body));
                    } catch (JsonProcessingException ex) {
                        return Mono.error(new CatalogException(key, "Malformed answer for barcode " + barcode, ex));
                    }
                });
    }

    private Mono<ProductRecord> toRecord(final JsonNode envelope, final String barcode, final Language language) {
        if (!isSuccess(envelope.get("status"))) {
            log.debug("{} catalog has no product {} ({})", key, barcode, envelope.path("status_verbose").asText(""));
            return Mono.empty();
        }
        JsonNode product = envelope.get("product");
        if (product == null || !product.isObject()) {
            return Mono.empty();
        }
        if (!matchesExpectedType(product)) {
            log.debug("{} catalog product {} has type '{}', expected '{}'",
                    key, barcode, product.path("product_type").asText(), cfg.getExpectedProductType());
            return Mono.empty();
        }
        ProductRecord parsed = parser.parse(barcode, product, productType(), language);
        return Mono.just(parsed.toBuilder().retrievedAt(clock.instant()).build());
    }

    static boolean isSuccess(final JsonNode status) {
        if (status == null || status.isNull()) {
            return false;
        }
        if (status.isNumber()) {
            return status.asInt() == 1;
        }
        String text = status.asText().trim().toLowerCase(Locale.ROOT);
        return "1".equals(text) || text.startsWith("success");
    }

    private boolean matchesExpectedType(final JsonNode product) {
        String expected = cfg.getExpectedProductType();
        if (StringUtils.isBlank(expected)) {
            return true;
        }
        String actual = StringUtils.trimToNull(product.path("product_type").asText(null));
        return actual == null || expected.equalsIgnoreCase(actual);
    }
}
