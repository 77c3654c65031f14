package com.products.lookup.validation;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Local barcode checks, run before any network call.
 */
@Component
public class BarcodeValidator {

    public static final int MIN_LENGTH = 8;

    public static final int MAX_LENGTH = 14;

    private static final int EAN13_LENGTH = 13;

    /**
     * @return {@code true} for 8 to 14 ASCII digits
     */
    public boolean isValid(final String barcode) {
        return StringUtils.isNotBlank(barcode)
                && barcode.length() >= MIN_LENGTH
                && barcode.length() <= MAX_LENGTH
                && isDigits(barcode);
    }

    /**
     * Verifies the EAN-13 check digit.
     */
    public boolean isValidEan13(final String barcode) {
        if (barcode == null || barcode.length() != EAN13_LENGTH || !isDigits(barcode)) {
            return false;
        }
        int sum = 0;
        for (int i = 0; i < EAN13_LENGTH - 1; i++) {
            int digit = barcode.charAt(i) - '0';
            sum += (i % 2 == 0) ? digit : digit * 3;
        }
        int check = (10 - (sum % 10)) % 10;
        return check == barcode.charAt(EAN13_LENGTH - 1) - '0';
    }

    /**
     * Rough guess from the GS1 prefix: 13 digits starting with 3 to 9.
     */
    public boolean isLikelyFoodProduct(final String barcode) {
        if (barcode == null || barcode.length() != EAN13_LENGTH || !isDigits(barcode)) {
            return false;
        }
        char first = barcode.charAt(0);
        return first >= '3' && first <= '9';
    }

    private static boolean isDigits(final String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
