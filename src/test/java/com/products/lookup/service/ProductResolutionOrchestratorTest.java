package com.products.lookup.service;

import com.products.lookup.cache.ProductCache;
import com.products.lookup.config.LookupProperties;
import com.products.lookup.model.Language;
import com.products.lookup.model.LanguageList;
import com.products.lookup.model.LookupOutcome;
import com.products.lookup.model.PriceEnrichment;
import com.products.lookup.model.PriceRecord;
import com.products.lookup.model.ProductQuery;
import com.products.lookup.model.ProductRecord;
import com.products.lookup.model.ProductType;
import com.products.lookup.pricing.PriceAggregationService;
import com.products.lookup.support.MutableClock;
import com.products.lookup.validation.BarcodeValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProductResolutionOrchestratorTest {

    private static final String BARCODE = "3017620422003";

    private static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");

    @Mock
    private LanguageFallbackProductResolver resolver;

    @Mock
    private PriceAggregationService pricing;

    @Mock
    private ProductCache cache;

    @Mock
    private PricingSessionBootstrap bootstrap;

    private LookupProperties props;

    private ProductResolutionOrchestrator orchestrator;

    private final PriceRecord price = PriceRecord.builder()
            .amount(new BigDecimal("3.49"))
            .currency("EUR")
            .source(PriceRecord.SOURCE_OPEN_PRICES)
            .build();

    @BeforeEach
    void setUp() {
        props = new LookupProperties();
        props.setLanguages(List.of("fr", "en"));
        orchestrator = new ProductResolutionOrchestrator(new BarcodeValidator(), resolver, pricing, cache,
                bootstrap, props, new MutableClock(NOW));
    }

    private static ProductRecord product(final Instant retrievedAt) {
        return ProductRecord.builder()
                .barcode(BARCODE)
                .productType(ProductType.FOOD)
                .name("Nutella")
                .language(Language.FRENCH)
                .retrievedAt(retrievedAt)
                .build();
    }

    private PriceEnrichment enrichment() {
        return new PriceEnrichment(price, List.of(price), null);
    }

    @Test
    @DisplayName("invalid barcodes are rejected without any network call")
    void invalidBarcode() {
        for (String barcode : new String[] {"", "1234567", "123456789012345", "12345abc90", null}) {
            StepVerifier.create(orchestrator.getProduct(ProductQuery.of(barcode))).verifyComplete();
        }

        verifyNoInteractions(resolver, pricing, cache);
    }

    @Test
    @DisplayName("calling before initialization is a programming error")
    void notInitialized() {
        doThrow(new ServiceNotConfiguredException("not initialized")).when(bootstrap).ensureInitialized();

        assertThatThrownBy(() -> orchestrator.getProduct(ProductQuery.of(BARCODE)))
                .isInstanceOf(ServiceNotConfiguredException.class);
        verifyNoInteractions(resolver);
    }

    @Test
    @DisplayName("cache miss resolves, enriches and writes back")
    void cacheMiss() {
        ProductRecord resolved = product(NOW);
        when(cache.find(BARCODE, ProductType.FOOD)).thenReturn(Mono.empty());
        when(resolver.resolve(BARCODE, LanguageList.of(Language.FRENCH, Language.ENGLISH), ProductType.FOOD))
                .thenReturn(Mono.just(LookupOutcome.found(resolved)));
        when(pricing.enrich(BARCODE, "Paris")).thenReturn(Mono.just(enrichment()));
        when(cache.store(any())).thenReturn(Mono.empty());

        StepVerifier.create(orchestrator.getProduct(ProductQuery.of(BARCODE).withLocation("Paris")))
                .assertNext(p -> {
                    assertThat(p.getName()).isEqualTo("Nutella");
                    assertThat(p.getCurrentPrice()).isEqualTo(price);
                })
                .verifyComplete();

        verify(cache).store(any());
    }

    @Test
    @DisplayName("fresh cached record missing prices is enriched, not fetched again")
    void freshCacheEnriched() {
        when(cache.find(BARCODE, ProductType.FOOD)).thenReturn(Mono.just(product(NOW.minus(Duration.ofDays(1)))));
        when(pricing.enrich(BARCODE, null)).thenReturn(Mono.just(enrichment()));

        StepVerifier.create(orchestrator.getProduct(ProductQuery.of(BARCODE)))
                .assertNext(p -> assertThat(p.hasPriceData()).isTrue())
                .verifyComplete();

        verifyNoInteractions(resolver);
        verify(cache, never()).store(any());
    }

    @Test
    @DisplayName("fresh cached record without pricing request is served as is")
    void freshCacheBasic() {
        ProductRecord cached = product(NOW.minus(Duration.ofHours(1)));
        when(cache.find(BARCODE, ProductType.FOOD)).thenReturn(Mono.just(cached));

        StepVerifier.create(orchestrator.getProduct(ProductQuery.basic(BARCODE)))
                .expectNext(cached)
                .verifyComplete();

        verifyNoInteractions(resolver, pricing);
    }

    @Test
    @DisplayName("stale cached record is fetched again")
    void staleCache() {
        when(cache.find(BARCODE, ProductType.FOOD)).thenReturn(Mono.just(product(NOW.minus(Duration.ofDays(8)))));
        when(resolver.resolve(any(String.class), any(LanguageList.class), any(ProductType.class))).thenReturn(Mono.just(LookupOutcome.found(product(NOW))));
        when(cache.store(any())).thenReturn(Mono.empty());

        StepVerifier.create(orchestrator.getProduct(ProductQuery.basic(BARCODE)))
                .assertNext(p -> assertThat(p.getRetrievedAt()).isEqualTo(NOW))
                .verifyComplete();

        verifyNoInteractions(pricing);
    }

    @Test
    @DisplayName("cache write failure does not fail the lookup")
    void cacheWriteFailure() {
        when(cache.find(BARCODE, ProductType.FOOD)).thenReturn(Mono.empty());
        when(resolver.resolve(any(String.class), any(LanguageList.class), any(ProductType.class))).thenReturn(Mono.just(LookupOutcome.found(product(NOW))));
        when(cache.store(any())).thenReturn(Mono.error(new IllegalStateException("disk full")));

        StepVerifier.create(orchestrator.getProduct(ProductQuery.basic(BARCODE)))
                .expectNextCount(1)
                .verifyComplete();
    }

    @Test
    @DisplayName("failed resolution yields no product but keeps the reason")
    void failedResolution() {
        when(cache.find(BARCODE, ProductType.FOOD)).thenReturn(Mono.empty());
        when(resolver.resolve(any(String.class), any(LanguageList.class), any(ProductType.class)))
                .thenReturn(Mono.just(LookupOutcome.<ProductRecord>failed("fr: HTTP 503; en: HTTP 503")));

        StepVerifier.create(orchestrator.getProduct(ProductQuery.of(BARCODE))).verifyComplete();
        StepVerifier.create(orchestrator.resolve(ProductQuery.of(BARCODE)))
                .assertNext(outcome -> assertThat(outcome.status()).isEqualTo(LookupOutcome.Status.FAILED))
                .verifyComplete();

        verifyNoInteractions(pricing);
        verify(cache, never()).store(any());
    }

    @Test
    @DisplayName("disabled cache is neither read nor written")
    void cacheDisabled() {
        props.getCache().setEnabled(false);
        when(resolver.resolve(any(String.class), any(LanguageList.class), any(ProductType.class))).thenReturn(Mono.just(LookupOutcome.found(product(NOW))));

        StepVerifier.create(orchestrator.getProduct(ProductQuery.basic(BARCODE)))
                .expectNextCount(1)
                .verifyComplete();

        verifyNoInteractions(cache);
    }
}
