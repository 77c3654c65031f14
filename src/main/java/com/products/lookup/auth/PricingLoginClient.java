package com.products.lookup.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.products.lookup.config.PricingProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Performs the form-encoded credential exchange against the pricing
 * service's session endpoint.
 * <p>
 * The identifier is taken from a {@code session=<value>} attribute of a
 * {@code Set-Cookie} header when present, otherwise from the first non-blank
 * JSON body field among {@link #TOKEN_FIELDS}. Failures are reported as an
 * empty result, never as an error.
 * </p>
 */
@Slf4j
@Component
public class PricingLoginClient {

    /** JSON fields probed for the identifier, in priority order. */
    static final List<String> TOKEN_FIELDS = List.of("access_token", "token", "session_id");

    private static final Pattern SESSION_COOKIE = Pattern.compile("(?:^|[;,]\\s*)session=([^;,\\s]+)");

    private final WebClient client;

    private final PricingProperties props;

    private final ObjectMapper mapper;

    public PricingLoginClient(final WebClient.Builder builder,
                              final PricingProperties props,
                              @Qualifier("lookupObjectMapper") final ObjectMapper mapper) {
        this.props = props;
        this.mapper = mapper;
        this.client = builder.clone()
                .defaultHeader(HttpHeaders.USER_AGENT, props.getUserAgent())
                .build();
    }

    /**
     * Exchanges a username and password for a session identifier.
     *
     * @param username login name
     * @param password login password
     * @return the grant, or empty if the exchange failed or yielded no identifier
     */
    public Mono<LoginGrant> login(final String username, final String password) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("user_id", username);
        form.add("password", password);
        form.add("action", "process");

        return client.post()
                .uri(props.getSessionUrl())
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData(form))
                .exchangeToMono(this::readGrant)
                .doOnNext(grant -> log.info("Pricing login succeeded for user {} ({})", username, grant))
                .switchIfEmpty(Mono.defer(() -> {
                    log.warn("Pricing login for user {} yielded no session identifier", username);
                    return Mono.<LoginGrant>empty();
                }))
                .onErrorResume(ex -> {
                    log.warn("Pricing login request failed: {}", ex.toString());
                    return Mono.empty();
                });
    }

    private Mono<LoginGrant> readGrant(final ClientResponse resp) {
        if (!resp.statusCode().is2xxSuccessful()) {
            log.warn("Pricing login rejected with HTTP {}", resp.statusCode().value());
            return resp.releaseBody().then(Mono.empty());
        }

        Optional<String> cookie = sessionFromCookies(resp.headers().header(HttpHeaders.SET_COOKIE));
        if (cookie.isPresent()) {
            return resp.releaseBody().thenReturn(LoginGrant.fromCookie(cookie.get()));
        }
        return resp.bodyToMono(String.class)
                .flatMap(body -> Mono.justOrEmpty(tokenFromBody(body)))
                .map(LoginGrant::fromToken);
    }

    static Optional<String> sessionFromCookies(final List<String> setCookieHeaders) {
        for (String header : setCookieHeaders) {
            Matcher m = SESSION_COOKIE.matcher(header);
            if (m.find()) {
                return Optional.of(m.group(1));
            }
        }
        return Optional.empty();
    }

    Optional<String> tokenFromBody(final String body) {
        if (StringUtils.isBlank(body)) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException ex) {
            log.debug("Login response body is not JSON: {}", ex.getMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        return TOKEN_FIELDS.stream()
                .map(root::path)
                .filter(JsonNode::isTextual)
                .map(JsonNode::asText)
                .filter(StringUtils::isNotBlank)
                .findFirst();
    }
}
