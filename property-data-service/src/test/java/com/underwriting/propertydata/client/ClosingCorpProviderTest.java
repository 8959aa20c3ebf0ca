package com.underwriting.propertydata.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.underwriting.common.model.NormalizedAddress;
import com.underwriting.common.model.ProviderErrorKind;
import com.underwriting.common.model.ProviderResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.ClientRequest;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

class ClosingCorpProviderTest {

    private static final NormalizedAddress ADDRESS = NormalizedAddress.parse("5 Oak Ln, Tampa, FL 33602");

    private final StubExchange exchange = new StubExchange();
    private final ClosingCorpProvider provider =
        new ClosingCorpProvider(exchange.client(), new ObjectMapper(), Clock.systemUTC(), "cc-key");

    @Test
    @DisplayName("posts the address with a bearer token and reads the estimate")
    void closingCostEstimate() {
        exchange.json("{\"closing_costs\": {\"estimate\": 9150.456, \"currency\": \"USD\"}}");

        ProviderResult result = provider.fetchForProperty(ADDRESS).block();

        assertEquals(9150.46, result.patch().closingCostEstimate());
        assertNull(result.patch().rentEstimate());
        ClientRequest request = exchange.lastRequest();
        assertEquals(HttpMethod.POST, request.method());
        assertEquals("Bearer cc-key", request.headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    @DisplayName("quote without an estimate → UNAVAILABLE")
    void noEstimate() {
        exchange.json("{\"closing_costs\": {}}");
        assertEquals(ProviderErrorKind.UNAVAILABLE, provider.fetchForProperty(ADDRESS).block().error());
    }
}
