package com.products.lookup.auth;

import com.products.lookup.config.PricingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * <h2>AuthenticatedRequestExecutor</h2>
 *
 * <p>Sends requests to the pricing service with whatever credential the
 * current {@link AuthSession} carries and recovers from an expired login
 * session:</p>
 * <ol>
 *   <li>an expired login session is refreshed before the request goes out;</li>
 *   <li>a 401 answer under {@link AuthMethod#LOGIN_PASSWORD} triggers one
 *       refresh and, if it succeeded, exactly one resend;</li>
 *   <li>a 401 under a token or without credentials is handed back as is.</li>
 * </ol>
 *
 * <p>Non-2xx answers are returned as {@link PricingResponse}s; only transport
 * failures surface as error signals.</p>
 */
@Slf4j
@Component
public class AuthenticatedRequestExecutor {

    static final String SESSION_COOKIE = "session";

    private final WebClient webClient;

    private final AuthSessionManager sessions;

    public AuthenticatedRequestExecutor(final WebClient.Builder builder,
                                        final PricingProperties props,
                                        final AuthSessionManager sessions) {
        this.webClient = builder.clone()
                .baseUrl(props.getBaseUrl())
                .defaultHeader(HttpHeaders.USER_AGENT, props.getUserAgent())
                .build();
        this.sessions = sessions;
    }

    /**
     * @param method HTTP method
     * @param path   path relative to the pricing base URL
     * @param query  query parameters, may be {@code null}
     * @param body   JSON body, may be {@code null}
     * @return the final response; an error signal only for transport failures
     */
    public Mono<PricingResponse> execute(final HttpMethod method,
                                         final String path,
                                         @Nullable final MultiValueMap<String, String> query,
                                         @Nullable final Object body) {
        MultiValueMap<String, String> params = query == null ? new LinkedMultiValueMap<>() : query;

        return Mono.defer(this::refreshIfExpired)
                .then(Mono.defer(() -> send(method, path, params, body)))
                .flatMap(first -> {
                    if (!first.isUnauthorized() || sessions.method() != AuthMethod.LOGIN_PASSWORD) {
                        return Mono.just(first);
                    }
                    log.info("Pricing service answered 401 for {} {}, refreshing session", method, path);
                    return sessions.refresh().flatMap(ok -> ok
                            ? send(method, path, params, body)
                            : Mono.just(first));
                });
    }

    public Mono<PricingResponse> get(final String path, @Nullable final MultiValueMap<String, String> query) {
        return execute(HttpMethod.GET, path, query, null);
    }

    public Mono<PricingResponse> post(final String path, final Object body) {
        return execute(HttpMethod.POST, path, null, body);
    }

    private Mono<Boolean> refreshIfExpired() {
        if (sessions.method() == AuthMethod.LOGIN_PASSWORD && sessions.isExpired()) {
            log.debug("Pricing session expired, refreshing before request");
            return sessions.refresh();
        }
        return Mono.just(Boolean.TRUE);
    }

    private Mono<PricingResponse> send(final HttpMethod method,
                                       final String path,
                                       final MultiValueMap<String, String> query,
                                       @Nullable final Object body) {
        AuthSession current = sessions.currentSession();

        WebClient.RequestBodySpec spec = webClient.method(method)
                .uri(b -> b.path(path).queryParams(query).build())
                .accept(MediaType.APPLICATION_JSON)
                .headers(h -> applyCredentials(h, current));

        WebClient.RequestHeadersSpec<?> ready = body == null
                ? spec
                : spec.contentType(MediaType.APPLICATION_JSON).bodyValue(body);

        return ready.exchangeToMono(resp -> resp.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(text -> new PricingResponse(resp.statusCode().value(), text)));
    }

    /**
     * Adds the credential of {@code session} to {@code headers}; nothing when
     * the session carries none.
     */
    static void applyCredentials(final HttpHeaders headers, final AuthSession session) {
        if (session.getAccessToken() == null) {
            return;
        }
        if (session.getMethod() == AuthMethod.LOGIN_PASSWORD && session.getSessionCookie() != null) {
            headers.add(HttpHeaders.COOKIE, SESSION_COOKIE + "=" + session.getSessionCookie());
        } else {
            headers.setBearerAuth(session.getAccessToken());
        }
    }
}
