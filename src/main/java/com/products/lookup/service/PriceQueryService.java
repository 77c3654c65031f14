package com.products.lookup.service;

import com.products.lookup.model.PriceRecord;
import com.products.lookup.model.PriceStatistics;
import com.products.lookup.model.PriceSubmission;
import com.products.lookup.pricing.OpenPricesClient;
import com.products.lookup.validation.BarcodeValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Direct price operations, outside of a product lookup.
 * <p>
 * Every method requires an initialized service and rejects invalid barcodes
 * locally, answering empty without a network call.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PriceQueryService {

    private final OpenPricesClient prices;

    private final BarcodeValidator validator;

    private final PricingSessionBootstrap bootstrap;

    public Mono<PriceRecord> latest(final String barcode, @Nullable final String location) {
        bootstrap.ensureInitialized();
        return validator.isValid(barcode) ? prices.getLatestPrice(barcode, location) : Mono.empty();
    }

    public Mono<List<PriceRecord>> history(final String barcode,
                                           final int limit,
                                           @Nullable final String location,
                                           @Nullable final LocalDate since) {
        bootstrap.ensureInitialized();
        if (!validator.isValid(barcode)) {
            return Mono.just(List.of());
        }
        return prices.getProductPrices(barcode, limit, location, since);
    }

    public Mono<PriceStatistics> stats(final String barcode, @Nullable final String location) {
        bootstrap.ensureInitialized();
        return validator.isValid(barcode) ? prices.getPriceStats(barcode, location) : Mono.empty();
    }

    public Mono<List<Map<String, Object>>> search(@Nullable final String location,
                                                  @Nullable final String storeBrand,
                                                  final int limit) {
        bootstrap.ensureInitialized();
        return prices.searchProductsWithPrices(location, storeBrand, limit);
    }

    public Mono<List<Map<String, Object>>> locations(final int limit) {
        bootstrap.ensureInitialized();
        return prices.getLocations(limit);
    }

    /**
     * @return {@code true} if the pricing service accepted the observation
     */
    public Mono<Boolean> submit(final PriceSubmission submission) {
        bootstrap.ensureInitialized();
        if (!validator.isValid(submission.barcode())) {
            log.debug("Rejected price submission for invalid barcode '{}'", submission.barcode());
            return Mono.just(Boolean.FALSE);
        }
        return prices.submitPrice(submission);
    }

    public Mono<Map<String, Object>> apiStatus() {
        bootstrap.ensureInitialized();
        return prices.getApiStatus();
    }
}
