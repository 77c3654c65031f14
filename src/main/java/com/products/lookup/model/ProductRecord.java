package com.products.lookup.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Product data resolved from one catalog in one language, optionally enriched
 * with prices.
 * <p>
 * Instances are immutable; enrichment produces a copy through
 * {@link #withPricing(PriceEnrichment)}.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class ProductRecord {

    String barcode;

    ProductType productType;

    String name;

    String brand;

    String ingredients;

    @Builder.Default
    List<String> allergens = List.of();

    /** Nutrition grade (A–E), food products only. */
    String nutriScore;

    /** Processing level group (1–4), food products only. */
    Integer novaGroup;

    /** Shelf life once opened, cosmetics only (e.g. {@code "12M"}). */
    String periodAfterOpening;

    String imageUrl;

    String ingredientsImageUrl;

    String nutritionImageUrl;

    /** Language the catalog answered in. */
    Language language;

    Instant retrievedAt;

    PriceRecord currentPrice;

    @Builder.Default
    List<PriceRecord> recentPrices = List.of();

    PriceStatistics priceStats;

    /**
     * @return a copy carrying the given pricing context; the receiver is returned
     *         unchanged when {@code pricing} is {@code null} or empty
     */
    public ProductRecord withPricing(final PriceEnrichment pricing) {
        if (pricing == null || pricing.isEmpty()) {
            return this;
        }
        return toBuilder()
                .currentPrice(pricing.current())
                .recentPrices(pricing.recent())
                .priceStats(pricing.stats())
                .build();
    }

    public boolean hasPriceData() {
        return currentPrice != null || !recentPrices.isEmpty();
    }

    public boolean hasBasicInfo() {
        return name != null || brand != null;
    }

    public boolean hasNutritionInfo() {
        return nutriScore != null || novaGroup != null;
    }

    /**
     * @param maxAge maximum age of a cached record
     * @param now    reference instant
     * @return {@code true} if the record was retrieved no longer than {@code maxAge} before {@code now}
     */
    public boolean isFresh(final Duration maxAge, final Instant now) {
        return retrievedAt != null && !retrievedAt.plus(maxAge).isBefore(now);
    }
}
