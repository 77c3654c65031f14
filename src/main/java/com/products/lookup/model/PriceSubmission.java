package com.products.lookup.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A new price observation to report to the pricing service.
 *
 * @param barcode         product code
 * @param price           observed amount
 * @param currency        ISO 4217 code
 * @param locationId      OpenStreetMap id of the store
 * @param locationOsmType OpenStreetMap element type, {@code NODE} when {@code null}
 * @param date            observation date, today when {@code null}
 * @param proofUrl        optional proof reference
 */
public record PriceSubmission(String barcode,
                              BigDecimal price,
                              String currency,
                              String locationId,
                              String locationOsmType,
                              LocalDate date,
                              String proofUrl) {

    public static final String DEFAULT_OSM_TYPE = "NODE";

    public PriceSubmission {
        locationOsmType = locationOsmType == null ? DEFAULT_OSM_TYPE : locationOsmType;
    }
}
