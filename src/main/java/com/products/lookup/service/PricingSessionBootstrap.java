package com.products.lookup.service;

import com.products.lookup.auth.AuthSessionManager;
import com.products.lookup.auth.AuthStatus;
import com.products.lookup.auth.CredentialBundle;
import com.products.lookup.auth.CredentialStore;
import com.products.lookup.config.LookupProperties;
import com.products.lookup.config.PricingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * <h2>PricingSessionBootstrap</h2>
 *
 * <p>Brings the lookup service into its configured state: resolves the
 * credential bundle, configures the {@link AuthSessionManager} and, when the
 * stored credentials do not authenticate, falls back to the manually
 * configured token ({@code pricing.credentials.manual-token}).</p>
 *
 * <p>Runs once the application is ready unless
 * {@code lookup.auto-initialize=false}; until then every lookup operation
 * throws {@link ServiceNotConfiguredException}.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PricingSessionBootstrap {

    private final CredentialStore credentials;

    private final AuthSessionManager sessions;

    private final PricingProperties pricing;

    private final LookupProperties lookup;

    private final AtomicBoolean initialized = new AtomicBoolean();

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!lookup.isAutoInitialize()) {
            log.info("Automatic initialization disabled, waiting for an explicit initialize()");
            return;
        }
        initialize().subscribe(
                ok -> log.info("Product lookup initialized (pricing authenticated: {})", ok),
                ex -> log.error("Product lookup initialization failed", ex));
    }

    /**
     * Configures the pricing session and marks the service ready. Missing or
     * rejected credentials leave pricing read-only, never fail.
     *
     * @return {@code true} if an authenticated pricing session is held afterwards
     */
    public Mono<Boolean> initialize() {
        return Mono.fromCallable(credentials::resolve)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(bundle -> sessions.configure(bundle)
                        .flatMap(ok -> ok ? Mono.just(Boolean.TRUE) : manualTokenFallback()))
                .doOnNext(ok -> initialized.set(true));
    }

    /**
     * Reads the credential source again and reconfigures the session.
     */
    public Mono<Boolean> reloadCredentials() {
        return Mono.defer(() -> {
            log.info("Reloading pricing credentials");
            credentials.clear();
            sessions.reset();
            return initialize();
        });
    }

    /**
     * Drops the session and every secret held in memory. The service has to
     * be initialized again before further use.
     */
    public void dispose() {
        sessions.dispose();
        credentials.clear();
        initialized.set(false);
        log.info("Product lookup disposed");
    }

    public boolean isInitialized() {
        return initialized.get();
    }

    /**
     * @throws ServiceNotConfiguredException if {@link #initialize()} has not completed
     */
    public void ensureInitialized() {
        if (!initialized.get()) {
            throw new ServiceNotConfiguredException(
                    "Product lookup is not initialized; call PricingSessionBootstrap.initialize() first");
        }
    }

    public CredentialStatus credentialStatus() {
        CredentialBundle bundle = credentials.current();
        AuthStatus auth = sessions.status();
        return new CredentialStatus(
                credentials.isLoaded(),
                pricing.isEnabled(),
                auth.authenticated(),
                auth.method(),
                auth.expired(),
                pricing.isEnabled() && auth.authenticated(),
                bundle.hasToken(),
                bundle.hasLogin(),
                bundle.getMethod());
    }

    private Mono<Boolean> manualTokenFallback() {
        CredentialBundle manual = CredentialBundle.ofToken(pricing.getCredentials().getManualToken());
        if (!manual.hasToken()) {
            return Mono.just(Boolean.FALSE);
        }
        log.info("Stored credentials did not authenticate, using the manually configured token");
        return sessions.configure(manual);
    }
}
