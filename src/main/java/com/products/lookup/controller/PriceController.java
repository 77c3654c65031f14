package com.products.lookup.controller;

import com.products.lookup.dto.PriceSubmissionRequest;
import com.products.lookup.model.PriceRecord;
import com.products.lookup.model.PriceStatistics;
import com.products.lookup.service.PriceQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * REST controller exposing price queries and submissions.
 * <p>
 * Endpoints under <code>/api/prices</code>:
 * </p>
 * <ul>
 *   <li><code>GET /{barcode}/latest</code>: most recent price, 404 when none</li>
 *   <li><code>GET /{barcode}/history?limit=&amp;since=</code>: newest first</li>
 *   <li><code>GET /{barcode}/stats</code>: recent-window statistics, 404 when none</li>
 *   <li><code>GET /search?location=&amp;storeBrand=&amp;limit=</code>: raw price rows</li>
 *   <li><code>GET /locations?limit=</code>: raw store rows</li>
 *   <li><code>POST /</code>: report a price, 201 when accepted, 422 otherwise</li>
 * </ul>
 */
@RestController
@RequestMapping(path = "/api/prices", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class PriceController {

    private final PriceQueryService prices;

    @GetMapping("/{barcode}/latest")
    public Mono<ResponseEntity<PriceRecord>> latest(@PathVariable final String barcode,
                                                    @RequestParam(required = false) final String location) {
        return prices.latest(barcode, location)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/{barcode}/history")
    public Mono<List<PriceRecord>> history(
            @PathVariable final String barcode,
            @RequestParam(defaultValue = "20") final int limit,
            @RequestParam(required = false) final String location,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) final LocalDate since) {
        return prices.history(barcode, limit, location, since);
    }

    @GetMapping("/{barcode}/stats")
    public Mono<ResponseEntity<PriceStatistics>> stats(@PathVariable final String barcode,
                                                       @RequestParam(required = false) final String location) {
        return prices.stats(barcode, location)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/search")
    public Mono<List<Map<String, Object>>> search(@RequestParam(required = false) final String location,
                                                  @RequestParam(required = false) final String storeBrand,
                                                  @RequestParam(defaultValue = "20") final int limit) {
        return prices.search(location, storeBrand, limit);
    }

    @GetMapping("/locations")
    public Mono<List<Map<String, Object>>> locations(@RequestParam(defaultValue = "50") final int limit) {
        return prices.locations(limit);
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Void>> submit(@RequestBody @Validated final PriceSubmissionRequest request) {
        return prices.submit(request.toSubmission())
                .map(ok -> ok
                        ? ResponseEntity.status(HttpStatus.CREATED).<Void>build()
                        : ResponseEntity.unprocessableEntity().<Void>build());
    }
}
