package com.products.lookup.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.products.lookup.config.CatalogCfg;
import com.products.lookup.config.CatalogConfigFactory;
import com.products.lookup.config.CatalogProperties;
import com.products.lookup.model.Language;
import com.products.lookup.model.ProductType;
import com.products.lookup.parser.OpenFactsProductParser;
import com.products.lookup.support.MutableClock;
import com.products.lookup.support.StubExchange;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import reactor.test.StepVerifier;

import java.net.URI;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class CatalogSearchEngineTest {

    private static final String BARCODE = "3017620422003";

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private CatalogConfigFactory factory;

    @BeforeEach
    void setUp() {
        CatalogProperties props = new CatalogProperties();

        CatalogCfg food = new CatalogCfg();
        food.setBaseUrl("https://food.test");
        food.setProductType(ProductType.FOOD);
        props.getConfigs().put("food", food);

        CatalogCfg beauty = new CatalogCfg();
        beauty.setBaseUrl("https://beauty.test");
        beauty.setProductType(ProductType.BEAUTY);
        beauty.setExpectedProductType("beauty");
        props.getConfigs().put("beauty", beauty);

        factory = new CatalogConfigFactory(props);
    }

    private FoodCatalogClient food(final StubExchange exchange) {
        return new FoodCatalogClient(new OpenFactsProductParser(), factory, exchange.builder(), new ObjectMapper(),
                CircuitBreakerRegistry.ofDefaults(), RateLimiterRegistry.ofDefaults(), new MutableClock(NOW));
    }

    private BeautyCatalogClient beauty(final StubExchange exchange) {
        return new BeautyCatalogClient(new OpenFactsProductParser(), factory, exchange.builder(), new ObjectMapper(),
                CircuitBreakerRegistry.ofDefaults(), RateLimiterRegistry.ofDefaults(), new MutableClock(NOW));
    }

    @Test
    @DisplayName("found product is mapped and stamped with language and retrieval time")
    void foundProduct() {
        StubExchange exchange = new StubExchange(req -> StubExchange.json(HttpStatus.OK,
                "{\"status\":1,\"status_verbose\":\"product found\","
                        + "\"product\":{\"code\":\"" + BARCODE + "\",\"product_name_fr\":\"Nutella\"}}"));

        StepVerifier.create(food(exchange).fetchProduct(BARCODE, Language.FRENCH))
                .assertNext(p -> {
                    assertThat(p.getName()).isEqualTo("Nutella");
                    assertThat(p.getProductType()).isEqualTo(ProductType.FOOD);
                    assertThat(p.getLanguage()).isEqualTo(Language.FRENCH);
                    assertThat(p.getRetrievedAt()).isEqualTo(NOW);
                })
                .verifyComplete();

        ClientRequest request = exchange.requests().get(0);
        URI url = request.url();
        assertThat(url.getHost()).isEqualTo("food.test");
        assertThat(url.getPath()).isEqualTo("/api/v2/product/" + BARCODE);
        assertThat(url.getQuery()).contains("lc=fr").contains("product_name_fr").doesNotContain("{lc}");
    }

    @Test
    @DisplayName("textual success status is accepted")
    void textualSuccess() {
        StubExchange exchange = new StubExchange(req -> StubExchange.json(HttpStatus.OK,
                "{\"status\":\"success\",\"product\":{\"product_name\":\"Soap\"}}"));

        StepVerifier.create(food(exchange).fetchProduct(BARCODE, Language.ENGLISH))
                .assertNext(p -> assertThat(p.getName()).isEqualTo("Soap"))
                .verifyComplete();
    }

    @Test
    @DisplayName("404 and a failed status flag both complete empty")
    void notFound() {
        StubExchange missing = new StubExchange(req -> StubExchange.json(HttpStatus.NOT_FOUND, "{}"));
        StepVerifier.create(food(missing).fetchProduct(BARCODE, Language.ENGLISH)).verifyComplete();

        StubExchange unknown = new StubExchange(req -> StubExchange.json(HttpStatus.OK,
                "{\"status\":0,\"status_verbose\":\"product not found\"}"));
        StepVerifier.create(food(unknown).fetchProduct(BARCODE, Language.ENGLISH)).verifyComplete();
    }

    @Test
    @DisplayName("server errors and malformed answers are error signals")
    void failures() {
        StubExchange broken = new StubExchange(req -> StubExchange.json(HttpStatus.BAD_GATEWAY, "oops"));
        StepVerifier.create(food(broken).fetchProduct(BARCODE, Language.ENGLISH))
                .expectError(CatalogException.class)
                .verify();

        StubExchange garbled = new StubExchange(req -> StubExchange.json(HttpStatus.OK, "{\"status\":"));
        StepVerifier.create(food(garbled).fetchProduct(BARCODE, Language.ENGLISH))
                .expectError(CatalogException.class)
                .verify();
    }

    @Test
    @DisplayName("a successful answer without a body is a failure, not a miss")
    void emptyBody() {
        StubExchange noBody = new StubExchange(req -> ClientResponse.create(HttpStatus.OK).build());
        StepVerifier.create(food(noBody).fetchProduct(BARCODE, Language.ENGLISH))
                .expectErrorSatisfies(ex -> assertThat(ex)
                        .isInstanceOf(CatalogException.class)
                        .hasMessageContaining("Empty answer"))
                .verify();

        StubExchange blank = new StubExchange(req -> StubExchange.json(HttpStatus.OK, "  "));
        StepVerifier.create(food(blank).fetchProduct(BARCODE, Language.ENGLISH))
                .expectError(CatalogException.class)
                .verify();
    }

    @Test
    @DisplayName("catalog with an expected product type rejects other types")
    void productTypeMismatch() {
        StubExchange exchange = new StubExchange(req -> StubExchange.json(HttpStatus.OK,
                "{\"status\":1,\"product\":{\"product_name\":\"Nutella\",\"product_type\":\"food\"}}"));

        StepVerifier.create(beauty(exchange).fetchProduct(BARCODE, Language.ENGLISH)).verifyComplete();
        assertThat(exchange.requests().get(0).url().getHost()).isEqualTo("beauty.test");
    }

    @Test
    @DisplayName("catalog with an expected product type accepts its own type")
    void productTypeMatch() {
        StubExchange exchange = new StubExchange(req -> StubExchange.json(HttpStatus.OK,
                "{\"status\":1,\"product\":{\"product_name\":\"Cream\",\"product_type\":\"beauty\"}}"));

        StepVerifier.create(beauty(exchange).fetchProduct(BARCODE, Language.ENGLISH))
                .assertNext(p -> assertThat(p.getProductType()).isEqualTo(ProductType.BEAUTY))
                .verifyComplete();
    }
}
