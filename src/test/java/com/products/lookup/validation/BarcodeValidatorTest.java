package com.products.lookup.validation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class BarcodeValidatorTest {

    private final BarcodeValidator validator = new BarcodeValidator();

    @ParameterizedTest
    @ValueSource(strings = {"12345678", "3017620422003", "12345678901234"})
    void acceptsEightToFourteenDigits(final String barcode) {
        assertThat(validator.isValid(barcode)).isTrue();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "1234567", "123456789012345", "30176204220O3", "3017620 422003", "-12345678"})
    void rejectsEverythingElse(final String barcode) {
        assertThat(validator.isValid(barcode)).isFalse();
    }

    @Test
    void ean13Checksum() {
        assertThat(validator.isValidEan13("3017620422003")).isTrue();
        assertThat(validator.isValidEan13("4006381333931")).isTrue();
        assertThat(validator.isValidEan13("3017620422004")).isFalse();
        assertThat(validator.isValidEan13("12345678")).isFalse();
    }

    @Test
    void likelyFoodPrefix() {
        assertThat(validator.isLikelyFoodProduct("3017620422003")).isTrue();
        assertThat(validator.isLikelyFoodProduct("0012345678905")).isFalse();
        assertThat(validator.isLikelyFoodProduct("30176204")).isFalse();
    }
}
