package com.products.lookup.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LanguageListTest {

    @Test
    void emptyInputFallsBackToEnglish() {
        assertThat(LanguageList.of(List.of()).asList()).containsExactly(Language.ENGLISH);
        assertThat(LanguageList.of((List<Language>) null).primary()).isEqualTo(Language.ENGLISH);
    }

    @Test
    void keepsGivenOrder() {
        LanguageList list = LanguageList.of(Language.FRENCH, Language.ENGLISH, Language.GERMAN);

        assertThat(list.primary()).isEqualTo(Language.FRENCH);
        assertThat(list).containsExactly(Language.FRENCH, Language.ENGLISH, Language.GERMAN);
    }

    @Test
    void codesAreCaseInsensitive() {
        assertThat(Language.fromCode(" FR ")).contains(Language.FRENCH);
        assertThat(Language.fromCode("xx")).isEmpty();
    }
}
