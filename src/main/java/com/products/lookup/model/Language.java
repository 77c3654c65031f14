package com.products.lookup.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Languages the catalog services can be queried in.
 * <p>
 * The {@link #getCode() code} is the ISO 639-1 tag sent to the catalog as the
 * {@code lc} parameter and used for the localized field suffixes
 * ({@code product_name_fr}, {@code ingredients_text_de}, …).
 * </p>
 */
public enum Language {

    ENGLISH("en", "English"),
    FRENCH("fr", "Français"),
    SPANISH("es", "Español"),
    GERMAN("de", "Deutsch"),
    ITALIAN("it", "Italiano"),
    PORTUGUESE("pt", "Português"),
    DUTCH("nl", "Nederlands"),
    CHINESE("zh", "中文"),
    JAPANESE("ja", "日本語"),
    ARABIC("ar", "العربية");

    private final String code;

    private final String displayName;

    Language(final String code, final String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Looks a language up by its two-letter tag, ignoring case.
     *
     * @param code ISO 639-1 tag such as {@code "fr"}
     * @return the matching language, or empty for unknown / blank tags
     */
    public static Optional<Language> fromCode(final String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(l -> l.code.equals(normalized))
                .findFirst();
    }
}
