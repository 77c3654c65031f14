package com.products.lookup.auth;

/**
 * Read-only view of the pricing session, computed on demand.
 *
 * @param authenticated        a credential is held and not expired
 * @param method               active authentication method
 * @param expired              the login session is past its expiry
 * @param hasStoredCredentials credentials are kept for refresh
 */
public record AuthStatus(boolean authenticated, AuthMethod method, boolean expired, boolean hasStoredCredentials) {
}
