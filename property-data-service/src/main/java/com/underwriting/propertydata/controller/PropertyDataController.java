package com.underwriting.propertydata.controller;

import com.underwriting.common.exception.AllProvidersFailedException;
import com.underwriting.common.exception.InvalidAddressException;
import com.underwriting.common.model.CanonicalPropertyData;
import com.underwriting.propertydata.service.AggregationOptions;
import com.underwriting.propertydata.service.PropertyAggregationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/property-data")
public class PropertyDataController {

    private static final Logger log = LoggerFactory.getLogger(PropertyDataController.class);

    private final PropertyAggregationService service;

    public PropertyDataController(PropertyAggregationService service) {
        this.service = service;
    }

    @GetMapping
    public Mono<ResponseEntity<CanonicalPropertyData>> aggregate(
            @RequestParam(required = false) String line1,
            @RequestParam(required = false) String city,
            @RequestParam(required = false) String state,
            @RequestParam(required = false) String zip,
            @RequestParam(defaultValue = "true") boolean includeArea,
            @RequestParam(defaultValue = "true") boolean includeComps) {
        return service.aggregate(line1, city, state, zip, new AggregationOptions(includeArea, includeComps))
            .map(ResponseEntity::ok)
            .onErrorResume(InvalidAddressException.class, e -> {
                log.info("Rejected address. component={} reason={}", e.getComponent(), e.getMessage());
                return Mono.just(ResponseEntity.badRequest().build());
            })
            .onErrorResume(AllProvidersFailedException.class, e ->
                Mono.just(ResponseEntity.status(HttpStatus.BAD_GATEWAY).build()));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
