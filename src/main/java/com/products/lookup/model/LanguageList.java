package com.products.lookup.model;

import java.util.Iterator;
import java.util.List;

/**
 * Ordered, never-empty list of languages to try when resolving a product.
 * <p>
 * An empty input collapses to {@link #DEFAULT}. Duplicates are kept as given:
 * the order is the resolution order and nothing else is inferred from it.
 * </p>
 */
public final class LanguageList implements Iterable<Language> {

    /** Language used when the caller supplies none. */
    public static final Language DEFAULT = Language.ENGLISH;

    private final List<Language> languages;

    private LanguageList(final List<Language> languages) {
        this.languages = languages;
    }

    public static LanguageList of(final List<Language> languages) {
        if (languages == null || languages.isEmpty()) {
            return new LanguageList(List.of(DEFAULT));
        }
        return new LanguageList(List.copyOf(languages));
    }

    public static LanguageList of(final Language... languages) {
        return of(List.of(languages));
    }

    public Language primary() {
        return languages.get(0);
    }

    public List<Language> asList() {
        return languages;
    }

    public int size() {
        return languages.size();
    }

    @Override
    public Iterator<Language> iterator() {
        return languages.iterator();
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof LanguageList other && languages.equals(other.languages);
    }

    @Override
    public int hashCode() {
        return languages.hashCode();
    }

    @Override
    public String toString() {
        return languages.toString();
    }
}
