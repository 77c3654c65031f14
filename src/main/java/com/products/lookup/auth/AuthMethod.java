package com.products.lookup.auth;

import java.util.Arrays;
import java.util.Comparator;

/**
 * How the pricing service is authenticated against.
 * <p>
 * {@link #getPrecedence() Precedence} is a total order: when several methods
 * are usable, the one with the lowest precedence value wins.
 * </p>
 */
public enum AuthMethod {

    /** Long-lived API token sent as a bearer header. Never expires, never refreshed. */
    API_TOKEN(0),

    /** Username/password exchanged for an expiring session. */
    LOGIN_PASSWORD(1),

    /** No credentials: read-only access. */
    NONE(2);

    private final int precedence;

    AuthMethod(final int precedence) {
        this.precedence = precedence;
    }

    public int getPrecedence() {
        return precedence;
    }

    /**
     * Picks the preferred method for the credentials at hand.
     *
     * @param tokenAvailable a usable API token is present
     * @param loginAvailable a non-empty username and password are both present
     * @return the highest-precedence method the inputs satisfy; {@link #NONE} otherwise
     */
    public static AuthMethod preferred(final boolean tokenAvailable, final boolean loginAvailable) {
        return Arrays.stream(values())
                .sorted(Comparator.comparingInt(AuthMethod::getPrecedence))
                .filter(m -> m.isSatisfiedBy(tokenAvailable, loginAvailable))
                .findFirst()
                .orElse(NONE);
    }

    private boolean isSatisfiedBy(final boolean tokenAvailable, final boolean loginAvailable) {
        return switch (this) {
            case API_TOKEN -> tokenAvailable;
            case LOGIN_PASSWORD -> loginAvailable;
            case NONE -> true;
        };
    }
}
