package com.products.lookup.auth;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

import java.util.Set;

/**
 * Resolved credentials for the pricing service.
 * <p>
 * Immutable. The {@link #getMethod() method} is decided once, at construction,
 * by {@link AuthMethod#preferred(boolean, boolean)}; consumers never
 * re-derive it. Secrets are excluded from {@link #toString()}.
 * </p>
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class CredentialBundle {

    /** Session lifetime used when the credential source does not specify one. */
    public static final int DEFAULT_SESSION_TIMEOUT_SECONDS = 3600;

    /** Template values that mean "not filled in". */
    static final Set<String> PLACEHOLDERS = Set.of(
            "your_api_token_here",
            "your_openfoodfacts_username",
            "your_openfoodfacts_password");

    private static final CredentialBundle NONE = new CredentialBundle(
            AuthMethod.NONE, null, null, null, DEFAULT_SESSION_TIMEOUT_SECONDS);

    private final AuthMethod method;

    @ToString.Exclude
    private final String token;

    private final String username;

    @ToString.Exclude
    private final String password;

    private final int sessionTimeoutSeconds;

    public static CredentialBundle none() {
        return NONE;
    }

    public static CredentialBundle ofToken(final String token) {
        return of(token, null, null, null);
    }

    public static CredentialBundle ofLogin(final String username, final String password, final Integer timeoutSeconds) {
        return of(null, username, password, timeoutSeconds);
    }

    /**
     * Builds a bundle from raw credential values, dropping blanks and template
     * placeholders and choosing the method by precedence.
     *
     * @param token          API token, may be {@code null}
     * @param username       login name, may be {@code null}
     * @param password       login password, may be {@code null}
     * @param timeoutSeconds session lifetime; {@code null} means {@value #DEFAULT_SESSION_TIMEOUT_SECONDS}
     * @return the resolved bundle
     */
    public static CredentialBundle of(final String token,
                                      final String username,
                                      final String password,
                                      final Integer timeoutSeconds) {
        String t = usable(token);
        String u = usable(username);
        String p = usable(password);
        int timeout = timeoutSeconds == null ? DEFAULT_SESSION_TIMEOUT_SECONDS : timeoutSeconds;

        AuthMethod method = AuthMethod.preferred(t != null, u != null && p != null);
        return new CredentialBundle(method, t, u, p, timeout);
    }

    public boolean hasToken() {
        return token != null;
    }

    public boolean hasLogin() {
        return username != null && password != null;
    }

    private static String usable(final String value) {
        if (StringUtils.isBlank(value) || PLACEHOLDERS.contains(value.trim())) {
            return null;
        }
        return value;
    }
}
