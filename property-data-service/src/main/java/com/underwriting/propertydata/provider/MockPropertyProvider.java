package com.underwriting.propertydata.provider;

import com.underwriting.common.model.NormalizedAddress;
import com.underwriting.common.model.PropertyDataPatch;
import com.underwriting.common.model.ProviderCapability;
import com.underwriting.common.model.ProviderResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Set;

/**
 * Fallback adapter used when no live source is configured. Returns the same fixed record
 * for every address, so aggregations against it are reproducible.
 */
public class MockPropertyProvider implements PropertyDataProvider {

    private static final Logger log = LoggerFactory.getLogger(MockPropertyProvider.class);

    public static final String ID = "mock";

    static final PropertyDataPatch FIXED_PATCH = PropertyDataPatch.builder()
        .beds(3.0)
        .baths(2.0)
        .sqft(1600)
        .lotSqft(6000)
        .yearBuilt(1995)
        .marketValueEstimate(375_000.0)
        .rentEstimate(2_450.0)
        .annualTaxes(4_200.0)
        .closingCostEstimate(8_000.0)
        .build();

    static final String FIXED_PAYLOAD = "{\"beds\":3,\"baths\":2,\"sqft\":1600,\"lot_sqft\":6000,"
        + "\"year_built\":1995,\"market_value_estimate\":375000,\"rent_estimate\":2450,"
        + "\"annual_taxes\":4200,\"closing_cost_estimate\":8000}";

    private final Clock clock;

    public MockPropertyProvider(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String providerId() {
        return ID;
    }

    @Override
    public Set<ProviderCapability> capabilities() {
        return Set.of(ProviderCapability.PROPERTY_LEVEL);
    }

    @Override
    public Mono<ProviderResult> fetchForProperty(NormalizedAddress address) {
        return Mono.fromSupplier(() -> {
            log.debug("Serving mock property data. address={}", address.format());
            return ProviderResult.property(ID, clock.instant(), Duration.ZERO, FIXED_PATCH, FIXED_PAYLOAD);
        });
    }
}
