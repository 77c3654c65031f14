package com.products.lookup.model;

import java.util.List;

/**
 * Pricing context attached to a resolved product.
 *
 * @param current most recent single observation, if any
 * @param recent  observations of the recent window, newest first as returned by the service
 * @param stats   statistics over {@code recent}; {@code null} when {@code recent} is empty
 */
public record PriceEnrichment(PriceRecord current, List<PriceRecord> recent, PriceStatistics stats) {

    private static final PriceEnrichment EMPTY = new PriceEnrichment(null, List.of(), null);

    public PriceEnrichment {
        recent = recent == null ? List.of() : List.copyOf(recent);
    }

    public static PriceEnrichment empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return current == null && recent.isEmpty();
    }
}
