package com.products.lookup.service;

import com.products.lookup.auth.AuthMethod;

/**
 * Snapshot of the credential and session state, as reported to operators.
 *
 * @param credentialsLoaded whether a credential document was read
 * @param pricingEnabled    administrative pricing switch
 * @param authenticated     whether a usable session is held
 * @param method            method of the current session
 * @param sessionExpired    whether the current session is past its expiry
 * @param canSubmitPrices   pricing enabled and authenticated
 * @param hasToken          the resolved credentials carry an API token
 * @param hasLogin          the resolved credentials carry a username and password
 * @param preferredMethod   method the resolved credentials select
 */
public record CredentialStatus(boolean credentialsLoaded,
                               boolean pricingEnabled,
                               boolean authenticated,
                               AuthMethod method,
                               boolean sessionExpired,
                               boolean canSubmitPrices,
                               boolean hasToken,
                               boolean hasLogin,
                               AuthMethod preferredMethod) {
}
