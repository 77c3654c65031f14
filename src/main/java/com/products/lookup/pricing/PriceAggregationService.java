package com.products.lookup.pricing;

import com.products.lookup.model.PriceEnrichment;
import com.products.lookup.model.PriceRecord;
import com.products.lookup.model.PriceStatistics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Attaches pricing context to a resolved product.
 * <p>
 * The latest price and the recent window are requested concurrently and
 * joined; statistics are derived from the recent window only. Pricing is an
 * optional enrichment: a disabled service or any failure yields
 * {@link PriceEnrichment#empty()}.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PriceAggregationService {

    private final OpenPricesClient prices;

    /**
     * @param barcode  product code
     * @param location store name filter, may be {@code null}
     * @return the joined pricing context, never an error signal
     */
    public Mono<PriceEnrichment> enrich(final String barcode, @Nullable final String location) {
        if (!prices.isEnabled()) {
            return Mono.just(PriceEnrichment.empty());
        }

        Mono<Optional<PriceRecord>> latest = prices.getLatestPrice(barcode, location)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
        Mono<List<PriceRecord>> recent = prices.getRecentPrices(barcode, location)
                .defaultIfEmpty(List.of());

        return Mono.zip(latest, recent)
                .map(t -> {
                    List<PriceRecord> window = t.getT2();
                    PriceStatistics stats = window.isEmpty() ? null : PriceStatistics.fromPrices(window);
                    return new PriceEnrichment(t.getT1().orElse(null), window, stats);
                })
                .doOnNext(e -> log.debug("Pricing for {}: current={}, recent={}",
                        barcode, e.current(), e.recent().size()))
                .onErrorResume(ex -> {
                    log.warn("Price enrichment for {} failed: {}", barcode, ex.toString());
                    return Mono.just(PriceEnrichment.empty());
                });
    }
}
