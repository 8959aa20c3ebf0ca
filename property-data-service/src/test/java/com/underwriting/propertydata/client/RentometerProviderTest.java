package com.underwriting.propertydata.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.underwriting.common.model.AreaRentBenchmark;
import com.underwriting.common.model.NormalizedAddress;
import com.underwriting.common.model.ProviderCapability;
import com.underwriting.common.model.ProviderErrorKind;
import com.underwriting.common.model.ProviderResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;

import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RentometerProviderTest {

    private static final NormalizedAddress ADDRESS = NormalizedAddress.parse("123 Main St, Boston, MA 02129");

    private static final String SUMMARY = """
        {"data": {"average": 2875.4, "median": 2750, "samples": 38, "percentile_25": 2400}}
        """;

    private final StubExchange exchange = new StubExchange();
    private final RentometerProvider provider =
        new RentometerProvider(exchange.client(), new ObjectMapper(), Clock.systemUTC(), "rm-key");

    @Test
    @DisplayName("declares both property and area capability")
    void capabilities() {
        assertTrue(provider.supports(ProviderCapability.PROPERTY_LEVEL));
        assertTrue(provider.supports(ProviderCapability.AREA_LEVEL));
    }

    @Test
    @DisplayName("property call: average becomes the rent estimate")
    void propertyRent() {
        exchange.json(SUMMARY);

        ProviderResult result = provider.fetchForProperty(ADDRESS).block();

        assertEquals(2875.4, result.patch().rentEstimate());
        assertNull(result.areaBenchmark());
        assertTrue(exchange.lastRequest().url().getQuery().contains("api_key=rm-key"));
    }

    @Test
    @DisplayName("area call: median and sample size keyed by zip")
    void areaBenchmark() {
        exchange.json(SUMMARY);

        ProviderResult result = provider.fetchForArea(ADDRESS).block();

        AreaRentBenchmark benchmark = result.areaBenchmark();
        assertEquals("02129", benchmark.areaKey());
        assertEquals(2750.0, benchmark.medianRent());
        assertEquals(38, benchmark.sampleSize());
        assertNull(result.patch());
    }

    @Test
    @DisplayName("concurrent property and area lookups share one request")
    void scopesShareOneRequest() {
        exchange.jsonAfter(Duration.ofMillis(50), SUMMARY);

        Tuple2<ProviderResult, ProviderResult> both =
            Mono.zip(provider.fetchForProperty(ADDRESS), provider.fetchForArea(ADDRESS)).block(Duration.ofSeconds(5));

        assertEquals(2875.4, both.getT1().patch().rentEstimate());
        assertEquals(2750.0, both.getT2().areaBenchmark().medianRent());
        assertEquals(both.getT1().rawPayload(), both.getT2().rawPayload());
        assertEquals(1, exchange.requests().size());
    }

    @Test
    @DisplayName("a lookup after the shared request completed asks again")
    void sequentialLookupsNotShared() {
        exchange.json(SUMMARY);

        provider.fetchForProperty(ADDRESS).block();
        provider.fetchForArea(ADDRESS).block();

        assertEquals(2, exchange.requests().size());
    }

    @Test
    @DisplayName("unwrapped summary is read as well")
    void topLevelSummary() {
        exchange.json("{\"mean\": 1999.99, \"median\": 1900}");
        assertEquals(1999.99, provider.fetchForProperty(ADDRESS).block().patch().rentEstimate());
    }

    @Test
    @DisplayName("neither average nor median → UNAVAILABLE")
    void noStatistic() {
        exchange.json("{\"data\": {\"samples\": 0}}");
        assertEquals(ProviderErrorKind.UNAVAILABLE, provider.fetchForProperty(ADDRESS).block().error());
    }
}
