package com.products.lookup.pricing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.products.lookup.auth.AuthMethod;
import com.products.lookup.auth.AuthSessionManager;
import com.products.lookup.auth.AuthenticatedRequestExecutor;
import com.products.lookup.auth.PricingResponse;
import com.products.lookup.config.PricingProperties;
import com.products.lookup.model.PriceRecord;
import com.products.lookup.model.PriceStatistics;
import com.products.lookup.model.PriceSubmission;
import com.products.lookup.parser.PriceJsonParser;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * <h2>OpenPricesClient</h2>
 *
 * <p>Typed operations over the crowd-sourced pricing service. Every call
 * goes through {@link AuthenticatedRequestExecutor}, so session refresh and
 * the single 401 retry apply uniformly.</p>
 *
 * <p>Failures never propagate: a disabled service, a 404, any other non-2xx
 * answer, a transport error or an unreadable body all yield an empty list
 * (or an empty {@link Mono}) after being logged.</p>
 */
@Slf4j
@Service
public class OpenPricesClient {

    static final String PRICES_PATH = "/prices";

    static final String LOCATIONS_PATH = "/locations";

    static final String STATUS_PATH = "/status";

    private static final TypeReference<Map<String, Object>> ROW = new TypeReference<>() { };

    private final AuthenticatedRequestExecutor executor;

    private final AuthSessionManager sessions;

    private final PricingProperties props;

    private final PriceJsonParser parser;

    private final ObjectMapper mapper;

    private final Clock clock;

    public OpenPricesClient(final AuthenticatedRequestExecutor executor,
                            final AuthSessionManager sessions,
                            final PricingProperties props,
                            final PriceJsonParser parser,
                            @Qualifier("lookupObjectMapper") final ObjectMapper mapper,
                            final Clock clock) {
        this.executor = executor;
        this.sessions = sessions;
        this.props = props;
        this.parser = parser;
        this.mapper = mapper;
        this.clock = clock;
    }

    public boolean isEnabled() {
        return props.isEnabled();
    }

    /**
     * Price history of a product, newest first.
     *
     * @param barcode  product code
     * @param size     maximum number of prices
     * @param location store name filter, may be {@code null}
     * @param since    oldest date to include, may be {@code null}
     * @return prices; empty on any failure
     */
    public Mono<List<PriceRecord>> getProductPrices(final String barcode,
                                                    final int size,
                                                    @Nullable final String location,
                                                    @Nullable final LocalDate since) {
        if (!props.isEnabled()) {
            return Mono.just(List.of());
        }
        MultiValueMap<String, String> q = new LinkedMultiValueMap<>();
        q.add("product_code", barcode);
        q.add("size", String.valueOf(size));
        q.add("order_by", "-date");
        if (since != null) {
            q.add("date__gte", since.toString());
        }
        if (StringUtils.isNotBlank(location)) {
            q.add("location_osm_name", location);
        }

        return executor.get(PRICES_PATH, q)
                .map(resp -> {
                    if (resp.isNotFound()) {
                        log.debug("No prices for {}", barcode);
                        return List.<PriceRecord>of();
                    }
                    if (!resp.isSuccessful()) {
                        log.warn("Pricing service answered {} for prices of {}", resp.status(), barcode);
                        return List.<PriceRecord>of();
                    }
                    List<PriceRecord> prices = parser.parseItems(readTree(resp));
                    log.debug("Found {} prices for {}", prices.size(), barcode);
                    return prices;
                })
                .onErrorResume(ex -> {
                    log.warn("Fetching prices for {} failed: {}", barcode, ex.toString());
                    return Mono.just(List.of());
                });
    }

    /**
     * @return the most recent price of the product, empty when none is known
     */
    public Mono<PriceRecord> getLatestPrice(final String barcode, @Nullable final String location) {
        return getProductPrices(barcode, 1, location, null)
                .flatMap(prices -> Mono.justOrEmpty(prices.stream()
                        .max(Comparator.comparing(PriceRecord::getDate,
                                Comparator.nullsFirst(Comparator.naturalOrder())))));
    }

    /**
     * @return prices of the recent window ({@code recent-window-days}, at most {@code recent-window-size})
     */
    public Mono<List<PriceRecord>> getRecentPrices(final String barcode, @Nullable final String location) {
        return getProductPrices(barcode, props.getRecentWindowSize(), location, windowStart());
    }

    /**
     * @return statistics over the recent window; empty when no price falls into it
     */
    public Mono<PriceStatistics> getPriceStats(final String barcode, @Nullable final String location) {
        return getProductPrices(barcode, props.getStatsWindowSize(), location, windowStart())
                .filter(prices -> !prices.isEmpty())
                .map(PriceStatistics::fromPrices);
    }

    /**
     * Raw price rows filtered by store.
     *
     * @param location   store name filter, may be {@code null}
     * @param storeBrand store display name filter, may be {@code null}
     * @param limit      page size
     */
    public Mono<List<Map<String, Object>>> searchProductsWithPrices(@Nullable final String location,
                                                                    @Nullable final String storeBrand,
                                                                    final int limit) {
        if (!props.isEnabled()) {
            return Mono.just(List.of());
        }
        MultiValueMap<String, String> q = new LinkedMultiValueMap<>();
        q.add("size", String.valueOf(limit));
        if (StringUtils.isNotBlank(location)) {
            q.add("location_osm_name", location);
        }
        if (StringUtils.isNotBlank(storeBrand)) {
            q.add("location_osm_display_name", storeBrand);
        }
        return fetchRows(PRICES_PATH, q, "price search");
    }

    /**
     * @return raw location rows known to the pricing service
     */
    public Mono<List<Map<String, Object>>> getLocations(final int limit) {
        if (!props.isEnabled()) {
            return Mono.just(List.of());
        }
        MultiValueMap<String, String> q = new LinkedMultiValueMap<>();
        q.add("size", String.valueOf(limit));
        return fetchRows(LOCATIONS_PATH, q, "locations");
    }

    /**
     * Reports a price observation. Needs credentials; without any, nothing is sent.
     *
     * @return {@code true} if the service accepted the price
     */
    public Mono<Boolean> submitPrice(final PriceSubmission submission) {
        if (!props.isEnabled()) {
            return Mono.just(Boolean.FALSE);
        }
        if (sessions.method() == AuthMethod.NONE) {
            log.info("Price submission for {} skipped: no pricing credentials", submission.barcode());
            return Mono.just(Boolean.FALSE);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("product_code", submission.barcode());
        body.put("price", submission.price());
        body.put("currency", submission.currency());
        body.put("location_osm_id", submission.locationId());
        body.put("location_osm_type", submission.locationOsmType());
        body.put("date", (submission.date() != null ? submission.date() : LocalDate.now(clock)).toString());
        if (StringUtils.isNotBlank(submission.proofUrl())) {
            body.put("proof", submission.proofUrl());
        }

        return executor.post(PRICES_PATH, body)
                .map(resp -> {
                    if (resp.status() == 200 || resp.status() == 201) {
                        log.info("Price submitted for {}", submission.barcode());
                        return Boolean.TRUE;
                    }
                    log.warn("Price submission for {} rejected with {}", submission.barcode(), resp.status());
                    return Boolean.FALSE;
                })
                .onErrorResume(ex -> {
                    log.warn("Price submission for {} failed: {}", submission.barcode(), ex.toString());
                    return Mono.just(Boolean.FALSE);
                });
    }

    /**
     * @return the service status document; empty on any failure
     */
    public Mono<Map<String, Object>> getApiStatus() {
        if (!props.isEnabled()) {
            return Mono.empty();
        }
        return executor.get(STATUS_PATH, null)
                .filter(PricingResponse::isSuccessful)
                .map(resp -> mapper.convertValue(readTree(resp), ROW))
                .onErrorResume(ex -> {
                    log.warn("Fetching pricing status failed: {}", ex.toString());
                    return Mono.empty();
                });
    }

    private Mono<List<Map<String, Object>>> fetchRows(final String path,
                                                      final MultiValueMap<String, String> q,
                                                      final String what) {
        return executor.get(path, q)
                .map(resp -> {
                    if (!resp.isSuccessful()) {
                        log.warn("Pricing service answered {} for {}", resp.status(), what);
                        return List.<Map<String, Object>>of();
                    }
                    List<Map<String, Object>> rows = new ArrayList<>();
                    for (JsonNode row : PriceJsonParser.rows(readTree(resp))) {
                        rows.add(mapper.convertValue(row, ROW));
                    }
                    return rows;
                })
                .onErrorResume(ex -> {
                    log.warn("Fetching {} failed: {}", what, ex.toString());
                    return Mono.just(List.of());
                });
    }

    private LocalDate windowStart() {
        return LocalDate.now(clock).minusDays(props.getRecentWindowDays());
    }

    private JsonNode readTree(final PricingResponse resp) {
        try {
            return mapper.readTree(resp.body());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unreadable pricing answer: " + ex.getOriginalMessage(), ex);
        }
    }
}
