package com.products.lookup.service;

import com.products.lookup.catalog.CatalogClient;
import com.products.lookup.catalog.CatalogRegistry;
import com.products.lookup.model.Language;
import com.products.lookup.model.LanguageList;
import com.products.lookup.model.LookupOutcome;
import com.products.lookup.model.ProductRecord;
import com.products.lookup.model.ProductType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <h2>LanguageFallbackProductResolver</h2>
 *
 * <p>Tries the languages of a {@link LanguageList} one after the other and
 * stops at the first one the catalog answers with a product. A failing
 * language is logged and skipped; later languages are never requested once
 * one succeeded.</p>
 *
 * <p>The outcome is {@link LookupOutcome.Status#FAILED} only when every
 * language failed, and {@link LookupOutcome.Status#NOT_FOUND} when at least
 * one catalog answered that it does not know the barcode.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LanguageFallbackProductResolver {

    private final CatalogRegistry catalogs;

    /**
     * @param barcode   validated barcode
     * @param languages languages in preference order
     * @param type      catalog to ask
     */
    public Mono<LookupOutcome<ProductRecord>> resolve(final String barcode,
                                                      final LanguageList languages,
                                                      final ProductType type) {
        return catalogs.find(type)
                .map(catalog -> resolveIn(catalog, barcode, languages))
                .orElseGet(() -> {
                    log.warn("No active catalog for {} products", type);
                    return Mono.just(LookupOutcome.notFound("no catalog for " + type));
                });
    }

    /**
     * Resolves against one specific catalog.
     */
    public Mono<LookupOutcome<ProductRecord>> resolveIn(final CatalogClient catalog,
                                                        final String barcode,
                                                        final LanguageList languages) {
        return Mono.defer(() -> {
            List<String> failures = Collections.synchronizedList(new ArrayList<>());

            return Flux.fromIterable(languages)
                    .concatMap(language -> attempt(catalog, barcode, language, failures))
                    .next()
                    .map(LookupOutcome::found)
                    .switchIfEmpty(Mono.fromSupplier(() -> {
                        if (failures.size() == languages.size()) {
                            log.warn("Every language failed for {}: {}", barcode, failures);
                            return LookupOutcome.<ProductRecord>failed(String.join("; ", failures));
                        }
                        log.info("Product {} not found in {}", barcode, languages.asList());
                        return LookupOutcome.<ProductRecord>notFound("not found in " + languages.asList());
                    }));
        });
    }

    private Mono<ProductRecord> attempt(final CatalogClient catalog,
                                        final String barcode,
                                        final Language language,
                                        final List<String> failures) {
        return Mono.defer(() -> catalog.fetchProduct(barcode, language))
                .doOnNext(p -> log.debug("Resolved {} in {}", barcode, language.getCode()))
                .onErrorResume(ex -> {
                    log.warn("Lookup of {} in {} failed: {}", barcode, language.getCode(), ex.toString());
                    failures.add(language.getCode() + ": " + ex.getMessage());
                    return Mono.empty();
                });
    }
}
