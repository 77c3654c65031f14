package com.products.lookup.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.products.lookup.model.PriceRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PriceJsonParserTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private final PriceJsonParser parser = new PriceJsonParser();

    @Test
    @DisplayName("maps price rows including store location")
    void mapsRows() throws Exception {
        List<PriceRecord> prices = parser.parseItems(mapper.readTree("""
                {"items": [
                  {"price": 3.49, "currency": "EUR", "date": "2024-04-02", "price_is_discounted": true,
                   "price_per": "KILOGRAM",
                   "location": {"osm_name": "Carrefour", "osm_brand": "Carrefour",
                                "osm_address_city": "Paris", "osm_display_name": "Carrefour, Paris, France"}},
                  {"price": "2.10", "currency": "EUR", "created": "2024-03-30T08:15:00Z",
                   "location": {"osm_display_name": "Lidl, Lyon"}},
                  {"currency": "EUR"}
                ]}
                """));

        assertThat(prices).hasSize(2);

        PriceRecord first = prices.get(0);
        assertThat(first.getAmount()).isEqualByComparingTo("3.49");
        assertThat(first.getDate()).isEqualTo(LocalDate.of(2024, 4, 2));
        assertThat(first.getStoreName()).isEqualTo("Carrefour");
        assertThat(first.getLocation()).isEqualTo("Paris");
        assertThat(first.isPromotional()).isTrue();
        assertThat(first.getUnitPrice()).isEqualByComparingTo("3.49");
        assertThat(first.getSource()).isEqualTo(PriceRecord.SOURCE_OPEN_PRICES);

        PriceRecord second = prices.get(1);
        assertThat(second.getAmount()).isEqualByComparingTo("2.10");
        assertThat(second.getDate()).isEqualTo(LocalDate.of(2024, 3, 30));
        assertThat(second.getLocation()).isEqualTo("Lidl, Lyon");
        assertThat(second.getUnitPrice()).isNull();
    }

    @Test
    @DisplayName("results array is accepted as well as items")
    void resultsArray() throws Exception {
        assertThat(parser.parseItems(mapper.readTree("{\"results\": [{\"price\": 1}]}"))).hasSize(1);
        assertThat(parser.parseItems(mapper.readTree("{\"total\": 0}"))).isEmpty();
    }
}
