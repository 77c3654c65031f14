package com.products.lookup.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One price observation reported to the pricing service.
 */
@Value
@Builder(toBuilder = true)
public class PriceRecord {

    /** Source tag of prices coming from the pricing service. */
    public static final String SOURCE_OPEN_PRICES = "open_prices";

    BigDecimal amount;

    String currency;

    /** Store name, when the observation is attached to a known location. */
    String storeName;

    String storeBrand;

    /** City (or display name) of the store location. */
    String location;

    LocalDate date;

    /** Price per kilogram / litre, only set when the observation is expressed that way. */
    BigDecimal unitPrice;

    boolean promotional;

    String source;

    @Override
    public String toString() {
        return amount + " " + currency + (storeName != null ? " @ " + storeName : "");
    }
}
