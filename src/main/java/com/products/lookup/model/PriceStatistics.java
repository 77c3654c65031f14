package com.products.lookup.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.Objects;

/**
 * Aggregate over a set of {@link PriceRecord}s.
 * <p>
 * Always recomputed from a price set; never stored on its own. The only
 * instance with {@code count == 0} is {@link #empty()}, which carries no
 * average, bounds, currency or date.
 * </p>
 *
 * @param average     arithmetic mean, two decimals, {@link RoundingMode#HALF_UP}
 * @param min         lowest amount
 * @param max         highest amount
 * @param currency    currency of the most recent observation
 * @param count       number of observations
 * @param lastUpdated most recent observation date, {@code null} if no input carried one
 */
public record PriceStatistics(BigDecimal average,
                              BigDecimal min,
                              BigDecimal max,
                              String currency,
                              int count,
                              LocalDate lastUpdated) {

    private static final int SCALE = 2;

    private static final PriceStatistics EMPTY = new PriceStatistics(null, null, null, null, 0, null);

    public PriceStatistics {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative");
        }
        if (count == 0 && (average != null || min != null || max != null)) {
            throw new IllegalArgumentException("empty statistics must not carry amounts");
        }
        if (count > 0 && (average == null || min == null || max == null)) {
            throw new IllegalArgumentException("statistics over " + count + " prices need average, min and max");
        }
    }

    public static PriceStatistics empty() {
        return EMPTY;
    }

    /**
     * Computes statistics over the given prices.
     *
     * @param prices observations; {@code null} elements and amounts are ignored
     * @return the aggregate, or {@link #empty()} when nothing usable is left
     */
    public static PriceStatistics fromPrices(final Collection<PriceRecord> prices) {
        if (prices == null || prices.isEmpty()) {
            return EMPTY;
        }
        var usable = prices.stream()
                .filter(Objects::nonNull)
                .filter(p -> p.getAmount() != null)
                .toList();
        if (usable.isEmpty()) {
            return EMPTY;
        }

        BigDecimal sum = BigDecimal.ZERO;
        BigDecimal min = null;
        BigDecimal max = null;
        for (PriceRecord p : usable) {
            BigDecimal amount = p.getAmount();
            sum = sum.add(amount);
            min = (min == null || amount.compareTo(min) < 0) ? amount : min;
            max = (max == null || amount.compareTo(max) > 0) ? amount : max;
        }
        BigDecimal average = sum.divide(BigDecimal.valueOf(usable.size()), SCALE, RoundingMode.HALF_UP);

        PriceRecord latest = usable.stream()
                .filter(p -> p.getDate() != null)
                .max(Comparator.comparing(PriceRecord::getDate))
                .orElse(usable.get(0));
        String currency = latest.getCurrency() != null
                ? latest.getCurrency()
                : usable.stream().map(PriceRecord::getCurrency).filter(Objects::nonNull).findFirst().orElse(null);

        return new PriceStatistics(average, min, max, currency, usable.size(), latest.getDate());
    }

    public boolean isEmpty() {
        return count == 0;
    }
}
