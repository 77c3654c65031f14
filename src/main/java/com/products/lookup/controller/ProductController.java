package com.products.lookup.controller;

import com.products.lookup.model.ProductQuery;
import com.products.lookup.model.ProductRecord;
import com.products.lookup.model.ProductType;
import com.products.lookup.service.ProductResolutionOrchestrator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * REST controller exposing barcode lookups.
 * <p>
 * Endpoint: <code>GET /api/products/{barcode}</code><br>
 * Produces: <code>application/json</code>
 * </p>
 *
 * <h3>Example Request</h3>
 * <pre>{@code
 * GET /api/products/3017620422003?pricing=true&location=Paris&type=food
 * }</pre>
 *
 * <p>Answers 200 with the product, or 404 when the barcode is invalid,
 * unknown, or could not be resolved.</p>
 */
@RestController
@RequestMapping("/api/products")
@RequiredArgsConstructor
public class ProductController {

    private final ProductResolutionOrchestrator orchestrator;

    /**
     * @param barcode  product barcode
     * @param pricing  attach prices
     * @param location store name filter for prices
     * @param type     catalog: {@code food}, {@code beauty} or {@code general}
     * @return the product or 404
     * @throws IllegalArgumentException if {@code type} is unknown
     */
    @GetMapping(path = "/{barcode}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ProductRecord>> getProduct(
            @PathVariable final String barcode,
            @RequestParam(defaultValue = "true") final boolean pricing,
            @RequestParam(required = false) final String location,
            @RequestParam(defaultValue = "food") final String type) {

        ProductQuery query = new ProductQuery(barcode, pricing, location, productType(type));
        return orchestrator.getProduct(query)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    static ProductType productType(final String type) {
        try {
            return ProductType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown product type " + type, ex);
        }
    }
}
