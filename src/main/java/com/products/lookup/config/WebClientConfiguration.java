package com.products.lookup.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import io.netty.handler.logging.LogLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.transport.logging.AdvancedByteBufFormat;

import java.time.Duration;
import java.util.List;
import java.util.Set;

@Configuration
@Slf4j
public class WebClientConfiguration {

    private static final Duration CONNECT_TIMEOUT  = Duration.ofSeconds(10);
    private static final Duration RESPONSE_TIMEOUT = Duration.ofSeconds(20);

    /** Headers whose values never reach the log. */
    private static final Set<String> MASKED_HEADERS = Set.of(
            HttpHeaders.AUTHORIZATION, HttpHeaders.COOKIE, HttpHeaders.SET_COOKIE);

    /**
     * Shared builder; every client clones it and sets its own base URL.
     */
    @Bean
    public WebClient.Builder webClientBuilder(@Qualifier("lookupObjectMapper") final ObjectMapper mapper) {

        /* --- JSON codecs wired to the custom ObjectMapper ------------------ */
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(cfg -> {
                    cfg.defaultCodecs()
                            .jackson2JsonEncoder(new Jackson2JsonEncoder(mapper, MediaType.APPLICATION_JSON));
                    cfg.defaultCodecs()
                            .jackson2JsonDecoder(new Jackson2JsonDecoder(mapper, MediaType.APPLICATION_JSON));
                    cfg.defaultCodecs().maxInMemorySize(2 * 1024 * 1024);
                })
                .build();

        ConnectionProvider pool = ConnectionProvider.builder("lookup-pool")
                .maxConnections(50)
                .pendingAcquireTimeout(Duration.ofMillis(2000))
                .build();

        HttpClient tcpClient = HttpClient.create(pool)
                .protocol(HttpProtocol.HTTP11)
                .compress(true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) CONNECT_TIMEOUT.toMillis())
                .responseTimeout(RESPONSE_TIMEOUT)
                .wiretap("reactor.netty.http.client.HttpClient",
                        LogLevel.TRACE, AdvancedByteBufFormat.SIMPLE);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(tcpClient))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .filter(logRequest())
                .filter(logResponse())
                .exchangeStrategies(strategies);
    }

    private static ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(req -> {
            log.debug("--> {} {}  {}", req.method(), req.url(), masked(req.headers()));
            return Mono.just(req);
        });
    }

    private static ExchangeFilterFunction logResponse() {
        return ExchangeFilterFunction.ofResponseProcessor(res -> {
            log.debug("<-- {}  {}", res.statusCode().value(), masked(res.headers().asHttpHeaders()));
            return Mono.just(res);
        });
    }

    static HttpHeaders masked(final HttpHeaders headers) {
        HttpHeaders copy = new HttpHeaders();
        headers.forEach((name, values) -> {
            boolean secret = MASKED_HEADERS.stream().anyMatch(name::equalsIgnoreCase);
            copy.put(name, secret ? List.of("***") : values);
        });
        return copy;
    }
}
