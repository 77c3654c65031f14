package com.products.lookup.auth;

/**
 * Source of pricing-service credentials.
 */
public interface CredentialStore {

    /**
     * @return the resolved credential bundle; {@link CredentialBundle#none()} when nothing usable is configured
     */
    CredentialBundle resolve();

    /**
     * @return the bundle already held in memory, never reading the source;
     * {@link CredentialBundle#none()} before the first {@link #resolve()} or after {@link #clear()}
     */
    CredentialBundle current();

    /**
     * @return {@code true} if a credential document was found and read
     */
    boolean isLoaded();

    /**
     * Drops every secret held in memory. The next {@link #resolve()} reads the source again.
     */
    void clear();
}
