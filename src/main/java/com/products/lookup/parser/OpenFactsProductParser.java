package com.products.lookup.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.products.lookup.model.Language;
import com.products.lookup.model.ProductRecord;
import com.products.lookup.model.ProductType;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * <h2>Open Facts product parser</h2>
 *
 * <p>Maps the {@code product} object shared by the food, beauty and general
 * product catalogs. Localised fields ({@code product_name_fr}, …) are
 * consulted after their unsuffixed counterpart; catalog-specific fields are
 * only read for the product type they belong to.</p>
 */
@Component("openFactsParser")
public class OpenFactsProductParser implements ProductJsonParser {

    @Override
    public ProductRecord parse(final String barcode,
                               final JsonNode product,
                               final ProductType type,
                               final Language language) {
        String lc = language.getCode();

        ProductRecord.ProductRecordBuilder b = ProductRecord.builder()
                .barcode(StringUtils.defaultIfBlank(text(product, "code"), barcode))
                .productType(type)
                .language(language)
                .name(firstText(product, "product_name", "product_name_" + lc,
                        "generic_name", "generic_name_" + lc))
                .brand(text(product, "brands"))
                .ingredients(stripMarkup(firstText(product, "ingredients_text", "ingredients_text_" + lc)))
                .allergens(allergens(product, type))
                .imageUrl(firstText(product, "image_front_url", "image_url"))
                .ingredientsImageUrl(text(product, "image_ingredients_url"));

        switch (type) {
            case FOOD:
                b.nutriScore(upper(text(product, "nutriscore_grade")))
                        .novaGroup(novaGroup(product))
                        .nutritionImageUrl(text(product, "image_nutrition_url"));
                break;
            case BEAUTY:
                b.periodAfterOpening(text(product, "periods_after_opening"));
                break;
            default:
                break;
        }
        return b.build();
    }

    /**
     * Allergen tags without their language prefix ({@code en:milk → milk});
     * falls back to the free-text {@code allergens} list. Non-food catalogs
     * also report {@code traces}.
     */
    static List<String> allergens(final JsonNode product, final ProductType type) {
        Set<String> result = new LinkedHashSet<>();

        JsonNode tags = product.path("allergens_tags");
        if (tags.isArray() && !tags.isEmpty()) {
            tags.forEach(t -> addTag(result, t.asText()));
        } else {
            splitInto(result, text(product, "allergens"));
        }
        if (type != ProductType.FOOD) {
            splitInto(result, text(product, "traces"));
        }
        return List.copyOf(result);
    }

    static String stripMarkup(final String raw) {
        if (StringUtils.isBlank(raw)) {
            return null;
        }
        return StringUtils.trimToNull(Jsoup.parse(raw).text());
    }

    private static void splitInto(final Set<String> target, final String csv) {
        if (StringUtils.isBlank(csv)) {
            return;
        }
        for (String part : csv.split(",")) {
            addTag(target, part);
        }
    }

    private static void addTag(final Set<String> target, final String tag) {
        String value = StringUtils.trimToNull(tag);
        if (value == null) {
            return;
        }
        int colon = value.indexOf(':');
        if (colon >= 0) {
            value = StringUtils.trimToNull(value.substring(colon + 1));
        }
        if (value != null) {
            target.add(value);
        }
    }

    private static Integer novaGroup(final JsonNode product) {
        JsonNode nova = product.get("nova_group");
        if (nova == null || nova.isNull()) {
            return null;
        }
        if (nova.canConvertToInt()) {
            return nova.asInt();
        }
        String text = nova.asText().trim();
        return StringUtils.isNumeric(text) ? Integer.valueOf(text) : null;
    }

    private static String firstText(final JsonNode node, final String... fields) {
        List<String> candidates = new ArrayList<>(fields.length);
        for (String f : fields) {
            candidates.add(text(node, f));
        }
        return candidates.stream().filter(StringUtils::isNotBlank).findFirst().orElse(null);
    }

    private static String text(final JsonNode node, final String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return StringUtils.trimToNull(value.asText());
    }

    private static String upper(final String value) {
        return value == null ? null : value.toUpperCase(Locale.ROOT);
    }
}
