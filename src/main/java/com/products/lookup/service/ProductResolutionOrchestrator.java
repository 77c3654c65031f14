package com.products.lookup.service;

import com.products.lookup.cache.ProductCache;
import com.products.lookup.config.LookupProperties;
import com.products.lookup.model.LookupOutcome;
import com.products.lookup.model.ProductQuery;
import com.products.lookup.model.ProductRecord;
import com.products.lookup.pricing.PriceAggregationService;
import com.products.lookup.validation.BarcodeValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * <h2>ProductResolutionOrchestrator</h2>
 *
 * <p>Entry point of a barcode lookup:</p>
 * <ol>
 *   <li>reject invalid barcodes without any network call;</li>
 *   <li>serve a fresh cached record, enriching it with prices if they were
 *       requested and are missing;</li>
 *   <li>otherwise resolve metadata through the language fallback;</li>
 *   <li>attach prices when requested;</li>
 *   <li>hand the result to the cache without waiting for it.</li>
 * </ol>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProductResolutionOrchestrator {

    private final BarcodeValidator validator;

    private final LanguageFallbackProductResolver resolver;

    private final PriceAggregationService pricing;

    private final ProductCache cache;

    private final PricingSessionBootstrap bootstrap;

    private final LookupProperties props;

    private final Clock clock;

    /**
     * @param query what to look up
     * @return the product, or empty when it is unknown, the barcode is invalid
     *         or every source failed
     * @throws ServiceNotConfiguredException if the service has not been initialized
     */
    public Mono<ProductRecord> getProduct(final ProductQuery query) {
        return resolve(query).flatMap(outcome -> Mono.justOrEmpty(outcome.value()));
    }

    /**
     * Same as {@link #getProduct(ProductQuery)} but keeps the reason of a miss.
     *
     * @throws ServiceNotConfiguredException if the service has not been initialized
     */
    public Mono<LookupOutcome<ProductRecord>> resolve(final ProductQuery query) {
        bootstrap.ensureInitialized();

        String barcode = query.barcode() == null ? null : query.barcode().trim();
        if (!validator.isValid(barcode)) {
            log.debug("Rejected invalid barcode '{}'", query.barcode());
            return Mono.just(LookupOutcome.notFound("invalid barcode"));
        }

        return cachedFresh(barcode, query)
                .flatMap(hit -> pricingIfMissing(hit, query))
                .map(LookupOutcome::found)
                .switchIfEmpty(Mono.defer(() -> fetch(barcode, query)));
    }

    private Mono<ProductRecord> cachedFresh(final String barcode, final ProductQuery query) {
        if (!props.getCache().isEnabled()) {
            return Mono.empty();
        }
        return Mono.defer(() -> cache.find(barcode, query.productType()))
                .filter(p -> p.isFresh(props.getCache().getMaxAge(), clock.instant()))
                .doOnNext(p -> log.debug("Serving {} from cache", barcode))
                .onErrorResume(ex -> {
                    log.warn("Product cache read for {} failed: {}", barcode, ex.toString());
                    return Mono.empty();
                });
    }

    private Mono<ProductRecord> pricingIfMissing(final ProductRecord cached, final ProductQuery query) {
        if (!query.includePricing() || cached.hasPriceData()) {
            return Mono.just(cached);
        }
        return pricing.enrich(cached.getBarcode(), query.location()).map(cached::withPricing);
    }

    private Mono<LookupOutcome<ProductRecord>> fetch(final String barcode, final ProductQuery query) {
        return resolver.resolve(barcode, props.languageList(), query.productType())
                .flatMap(outcome -> {
                    if (!outcome.isFound()) {
                        return Mono.just(outcome);
                    }
                    ProductRecord base = outcome.value();
                    Mono<ProductRecord> enriched = query.includePricing()
                            ? pricing.enrich(barcode, query.location()).map(base::withPricing)
                            : Mono.just(base);
                    return enriched
                            .doOnNext(this::writeBack)
                            .map(LookupOutcome::found);
                });
    }

    private void writeBack(final ProductRecord product) {
        if (!props.getCache().isEnabled()) {
            return;
        }
        Mono.defer(() -> cache.store(product))
                .subscribe(
                        null,
                        ex -> log.warn("Caching product {} failed: {}", product.getBarcode(), ex.toString()));
    }
}
