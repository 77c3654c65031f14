package com.products.lookup.auth;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Snapshot of the authenticated context against the pricing service.
 * <p>
 * Immutable; {@link AuthSessionManager} replaces the whole snapshot on every
 * transition. A {@code null} {@code expiresAt} never expires.
 * </p>
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class AuthSession {

    private final AuthMethod method;

    /** Bearer token or session identifier. */
    @ToString.Exclude
    private final String accessToken;

    private final Instant expiresAt;

    /** Session identifier carried as a {@code session} cookie, login sessions only. */
    @ToString.Exclude
    private final String sessionCookie;

    static AuthSession unauthenticated(final AuthMethod method) {
        return new AuthSession(method, null, null, null);
    }

    static AuthSession ofToken(final String token) {
        return new AuthSession(AuthMethod.API_TOKEN, token, null, null);
    }

    static AuthSession ofLogin(final String accessToken, final String sessionCookie, final Instant expiresAt) {
        return new AuthSession(AuthMethod.LOGIN_PASSWORD, accessToken, expiresAt, sessionCookie);
    }

    /**
     * Token sessions never expire; login sessions expire strictly after
     * {@code expiresAt}, or never when it is unset.
     */
    public boolean isExpired(final Instant now) {
        if (method != AuthMethod.LOGIN_PASSWORD || expiresAt == null) {
            return false;
        }
        return now.isAfter(expiresAt);
    }

    public boolean isAuthenticated(final Instant now) {
        return accessToken != null && !isExpired(now);
    }
}
