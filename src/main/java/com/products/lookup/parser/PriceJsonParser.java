package com.products.lookup.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.products.lookup.model.PriceRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Maps pricing-service rows into {@link PriceRecord}s.
 * <p>
 * Rows without a usable {@code price} are skipped.
 * </p>
 */
@Slf4j
@Component
public class PriceJsonParser {

    private static final Set<String> UNIT_PRICE_BASES = Set.of("KILOGRAM", "LITER");

    /**
     * @param root paged answer ({@code {"items": [...]}} or {@code {"results": [...]}}) or a bare array
     * @return mapped prices in answer order, never {@code null}
     */
    public List<PriceRecord> parseItems(final JsonNode root) {
        JsonNode items = rows(root);
        List<PriceRecord> prices = new ArrayList<>();
        if (!items.isArray()) {
            return prices;
        }
        for (JsonNode row : items) {
            PriceRecord price = parse(row);
            if (price != null) {
                prices.add(price);
            }
        }
        return prices;
    }

    /**
     * @param root paged answer or bare array
     * @return the row array, or a missing node when there is none
     */
    public static JsonNode rows(final JsonNode root) {
        if (root.isArray()) {
            return root;
        }
        JsonNode items = root.path("items");
        return items.isArray() ? items : root.path("results");
    }

    /**
     * @param row one price object
     * @return the mapped price, or {@code null} if the row carries no amount
     */
    public PriceRecord parse(final JsonNode row) {
        BigDecimal amount = decimal(row.get("price"));
        if (amount == null) {
            return null;
        }
        JsonNode location = row.path("location");

        return PriceRecord.builder()
                .amount(amount)
                .currency(text(row, "currency"))
                .date(date(row))
                .storeName(text(location, "osm_name"))
                .storeBrand(text(location, "osm_brand"))
                .location(StringUtils.defaultIfBlank(text(location, "osm_address_city"),
                        text(location, "osm_display_name")))
                .promotional(row.path("price_is_discounted").asBoolean(false))
                .unitPrice(UNIT_PRICE_BASES.contains(text(row, "price_per")) ? amount : null)
                .source(PriceRecord.SOURCE_OPEN_PRICES)
                .build();
    }

    private static LocalDate date(final JsonNode row) {
        String raw = StringUtils.defaultIfBlank(text(row, "date"), text(row, "created"));
        if (raw == null) {
            return null;
        }
        try {
            return LocalDate.parse(raw.length() > 10 ? raw.substring(0, 10) : raw);
        } catch (DateTimeParseException ex) {
            log.debug("Unparseable price date '{}'", raw);
            return null;
        }
    }

    private static BigDecimal decimal(final JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        String text = StringUtils.trimToNull(node.asText());
        if (text == null) {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static String text(final JsonNode node, final String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return StringUtils.trimToNull(value.asText());
    }
}
