package com.products.lookup.dto;

import com.products.lookup.model.PriceSubmission;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Request payload for reporting a price observation.
 *
 * @param barcode         product code
 * @param price           observed amount, strictly positive
 * @param currency        ISO 4217 code
 * @param locationId      OpenStreetMap id of the store
 * @param locationOsmType OpenStreetMap element type, {@code NODE} when omitted
 * @param date            observation date, today when omitted
 * @param proofUrl        optional proof reference
 */
public record PriceSubmissionRequest(
        @NotBlank String barcode,
        @NotNull @DecimalMin(value = "0.0", inclusive = false) BigDecimal price,
        @NotBlank @Pattern(regexp = "[A-Z]{3}") String currency,
        @NotBlank String locationId,
        String locationOsmType,
        LocalDate date,
        String proofUrl
) {

    public PriceSubmission toSubmission() {
        return new PriceSubmission(barcode.trim(), price, currency, locationId, locationOsmType, date, proofUrl);
    }
}
