package com.products.lookup.auth;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * <h2>AuthSessionManager</h2>
 *
 * <p>Owns the lifecycle of one authenticated session against the pricing
 * service:</p>
 * <ul>
 *   <li>{@link AuthMethod#API_TOKEN}: the token is the session; it never
 *       expires and refreshing it makes no network call.</li>
 *   <li>{@link AuthMethod#LOGIN_PASSWORD}: a login exchange produces an
 *       identifier valid for {@code sessionTimeoutSeconds}; refresh repeats
 *       the exchange with the credentials supplied to {@link #configure}.</li>
 *   <li>{@link AuthMethod#NONE}: read-only mode, never an error.</li>
 * </ul>
 *
 * <p>{@link #configure} and {@link #refresh} are coalesced: while one login is
 * in flight, further callers subscribe to its outcome instead of starting a
 * second exchange.</p>
 */
@Slf4j
@Component
public class AuthSessionManager {

    private final PricingLoginClient loginClient;

    private final Clock clock;

    private final AtomicReference<AuthSession> session =
            new AtomicReference<>(AuthSession.unauthenticated(AuthMethod.NONE));

    /** Credentials as supplied to {@link #configure}; kept apart from the session for refresh. */
    private final AtomicReference<CredentialBundle> stored = new AtomicReference<>(CredentialBundle.none());

    private final AtomicReference<CompletableFuture<Boolean>> inFlight = new AtomicReference<>();

    public AuthSessionManager(final PricingLoginClient loginClient, final Clock clock) {
        this.loginClient = loginClient;
        this.clock = clock;
    }

    /**
     * Establishes a session from the given credentials.
     *
     * @param bundle resolved credentials
     * @return {@code true} once authenticated; {@code false} for read-only mode or a failed login
     */
    public Mono<Boolean> configure(final CredentialBundle bundle) {
        Objects.requireNonNull(bundle, "bundle");
        return Mono.defer(() -> {
            stored.set(bundle);
            return coalesce(() -> authenticate(bundle));
        });
    }

    /**
     * Drops the current identifier and authenticates again with the stored
     * credentials.
     *
     * @return {@code true} if a valid session is held afterwards
     */
    public Mono<Boolean> refresh() {
        return coalesce(() -> {
            CredentialBundle creds = stored.get();
            switch (creds.getMethod()) {
                case API_TOKEN:
                    session.set(AuthSession.ofToken(creds.getToken()));
                    return Mono.just(Boolean.TRUE);
                case LOGIN_PASSWORD:
                    log.info("Refreshing pricing session for user {}", creds.getUsername());
                    session.set(AuthSession.unauthenticated(AuthMethod.LOGIN_PASSWORD));
                    return login(creds);
                default:
                    log.debug("No stored pricing credentials, refresh skipped");
                    return Mono.just(Boolean.FALSE);
            }
        });
    }

    public boolean isExpired() {
        return session.get().isExpired(clock.instant());
    }

    public boolean isAuthenticated() {
        return session.get().isAuthenticated(clock.instant());
    }

    /**
     * @return the current session snapshot; never {@code null}
     */
    public AuthSession currentSession() {
        return session.get();
    }

    public AuthMethod method() {
        return session.get().getMethod();
    }

    public boolean hasStoredCredentials() {
        return stored.get().getMethod() != AuthMethod.NONE;
    }

    public AuthStatus status() {
        AuthSession current = session.get();
        Instant now = clock.instant();
        return new AuthStatus(
                current.isAuthenticated(now),
                current.getMethod(),
                current.isExpired(now),
                hasStoredCredentials());
    }

    /**
     * Returns to the unauthenticated state; stored credentials are kept.
     */
    public void reset() {
        session.set(AuthSession.unauthenticated(AuthMethod.NONE));
    }

    /**
     * Returns to the unauthenticated state and forgets the stored credentials.
     */
    public void dispose() {
        reset();
        stored.set(CredentialBundle.none());
        log.debug("Pricing session disposed");
    }

    /* ------------------------------------------------------------------ */
    /* internals                                                          */
    /* ------------------------------------------------------------------ */

    private Mono<Boolean> authenticate(final CredentialBundle bundle) {
        switch (bundle.getMethod()) {
            case API_TOKEN:
                session.set(AuthSession.ofToken(bundle.getToken()));
                log.info("Pricing session configured with API token");
                return Mono.just(Boolean.TRUE);
            case LOGIN_PASSWORD:
                session.set(AuthSession.unauthenticated(AuthMethod.LOGIN_PASSWORD));
                return login(bundle);
            default:
                session.set(AuthSession.unauthenticated(AuthMethod.NONE));
                log.info("No pricing credentials, running read-only");
                return Mono.just(Boolean.FALSE);
        }
    }

    private Mono<Boolean> login(final CredentialBundle creds) {
        return loginClient.login(creds.getUsername(), creds.getPassword())
                .map(grant -> {
                    Instant expiresAt = creds.getSessionTimeoutSeconds() > 0
                            ? clock.instant().plusSeconds(creds.getSessionTimeoutSeconds())
                            : null;
                    session.set(AuthSession.ofLogin(grant.accessToken(), grant.sessionCookie(), expiresAt));
                    return Boolean.TRUE;
                })
                .defaultIfEmpty(Boolean.FALSE)
                .doOnNext(ok -> {
                    if (!ok) {
                        log.warn("Pricing login failed, session stays unauthenticated");
                    }
                });
    }

    /**
     * Runs {@code attempt} unless another attempt is already running, in which
     * case the caller gets that attempt's outcome.
     */
    private Mono<Boolean> coalesce(final Supplier<Mono<Boolean>> attempt) {
        return Mono.defer(() -> {
            CompletableFuture<Boolean> mine = new CompletableFuture<>();
            CompletableFuture<Boolean> running = inFlight.compareAndExchange(null, mine);
            if (running != null) {
                log.debug("Joining in-flight pricing authentication");
                return Mono.fromFuture(running, true);
            }
            return Mono.defer(attempt)
                    .defaultIfEmpty(Boolean.FALSE)
                    .onErrorResume(ex -> {
                        log.warn("Pricing authentication failed: {}", ex.toString());
                        return Mono.just(Boolean.FALSE);
                    })
                    .doOnNext(ok -> {
                        inFlight.compareAndSet(mine, null);
                        mine.complete(ok);
                    })
                    .doFinally(signal -> {
                        inFlight.compareAndSet(mine, null);
                        mine.complete(Boolean.FALSE);
                    });
        });
    }
}
