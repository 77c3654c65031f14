package com.products.lookup.auth;

/**
 * Raw outcome of one pricing request: HTTP status plus body text.
 *
 * @param status HTTP status code
 * @param body   response body, empty string when none
 */
public record PricingResponse(int status, String body) {

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    public boolean isUnauthorized() {
        return status == 401;
    }

    public boolean isNotFound() {
        return status == 404;
    }
}
