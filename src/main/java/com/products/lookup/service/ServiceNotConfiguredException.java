package com.products.lookup.service;

/**
 * Thrown when a lookup or price operation is called before
 * {@link PricingSessionBootstrap#initialize()} completed.
 */
public class ServiceNotConfiguredException extends IllegalStateException {

    public ServiceNotConfiguredException(final String message) {
        super(message);
    }
}
