package com.products.lookup.auth;

/**
 * Session identifier obtained from a successful login exchange.
 *
 * @param accessToken   identifier to present on subsequent calls
 * @param sessionCookie same identifier when it arrived as a {@code session} cookie, otherwise {@code null}
 */
record LoginGrant(String accessToken, String sessionCookie) {

    static LoginGrant fromCookie(final String value) {
        return new LoginGrant(value, value);
    }

    static LoginGrant fromToken(final String token) {
        return new LoginGrant(token, null);
    }

    @Override
    public String toString() {
        return "LoginGrant[" + (sessionCookie != null ? "cookie" : "token") + "]";
    }
}
