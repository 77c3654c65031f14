package com.products.lookup.controller;

import com.products.lookup.service.CredentialStatus;
import com.products.lookup.service.PriceQueryService;
import com.products.lookup.service.PricingSessionBootstrap;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Operational view of the pricing integration.
 */
@RestController
@RequestMapping(path = "/api/pricing", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class PricingStatusController {

    private final PriceQueryService prices;

    private final PricingSessionBootstrap bootstrap;

    /**
     * Status document of the remote pricing service; 503 when it cannot be reached.
     */
    @GetMapping("/status")
    public Mono<ResponseEntity<Map<String, Object>>> status() {
        return prices.apiStatus()
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.status(503).build());
    }

    @GetMapping("/credentials")
    public CredentialStatus credentials() {
        return bootstrap.credentialStatus();
    }

    @PostMapping("/credentials/reload")
    public Mono<CredentialStatus> reload() {
        return bootstrap.reloadCredentials().map(ok -> bootstrap.credentialStatus());
    }
}
