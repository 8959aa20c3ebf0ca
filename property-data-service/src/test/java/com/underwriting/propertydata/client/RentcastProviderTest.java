package com.underwriting.propertydata.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.underwriting.common.model.NormalizedAddress;
import com.underwriting.common.model.PropertyDataPatch;
import com.underwriting.common.model.ProviderErrorKind;
import com.underwriting.common.model.ProviderOutcome;
import com.underwriting.common.model.ProviderResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class RentcastProviderTest {

    private static final NormalizedAddress ADDRESS = NormalizedAddress.parse("123 Main St, Boston, MA 02129");
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private static final String PROPERTY = """
        [{
          "formattedAddress": "123 Main St, Boston, MA 02129",
          "bedrooms": 3,
          "bathrooms": 2.5,
          "squareFootage": 1820,
          "lotSize": 5000,
          "yearBuilt": 1987,
          "taxAssessments": {
            "2022": {"year": 2022, "value": 410000},
            "2023": {"year": 2023, "value": 432000}
          },
          "propertyTaxes": {
            "2022": {"year": 2022, "total": 4980},
            "2023": {"year": 2023, "total": 5120.5}
          }
        }]
        """;

    private final StubExchange exchange = new StubExchange();
    private final RentcastProvider provider = new RentcastProvider(
        exchange.client(), new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC), "rc-key");

    private ProviderResult fetch() {
        return provider.fetchForProperty(ADDRESS).block();
    }

    @Nested
    @DisplayName("successful lookups")
    class Success {

        @Test
        @DisplayName("maps structure, latest assessment and latest tax bill")
        void mapsFields() {
            exchange.json(PROPERTY);

            ProviderResult result = fetch();

            assertTrue(result.isSuccess());
            PropertyDataPatch patch = result.patch();
            assertEquals(3.0, patch.beds());
            assertEquals(2.5, patch.baths());
            assertEquals(1820, patch.sqft());
            assertEquals(5000, patch.lotSqft());
            assertEquals(1987, patch.yearBuilt());
            assertEquals(432000.0, patch.marketValueEstimate());
            assertEquals(5120.5, patch.annualTaxes());
            assertNull(patch.rentEstimate());
        }

        @Test
        @DisplayName("keeps the response body verbatim and stamps fetch metadata")
        void keepsRawPayload() {
            exchange.json(PROPERTY);

            ProviderResult result = fetch();

            assertEquals(PROPERTY, result.rawPayload());
            assertEquals(RentcastProvider.ID, result.providerId());
            assertEquals(NOW, result.metadata().fetchedAt());
            assertEquals(ProviderOutcome.SUCCESS, result.metadata().outcome());
        }

        @Test
        @DisplayName("sends the API key header and the one-line address")
        void requestShape() {
            exchange.json(PROPERTY);

            fetch();

            ClientRequest request = exchange.lastRequest();
            assertEquals(HttpMethod.GET, request.method());
            assertEquals("/properties", request.url().getPath());
            assertEquals("rc-key", request.headers().getFirst("X-Api-Key"));
            assertTrue(request.url().getRawQuery().startsWith("address="));
            assertTrue(request.url().getQuery().contains("123 MAIN ST, BOSTON, MA 02129"));
        }
    }

    @Nested
    @DisplayName("failures resolve to error results")
    class Failures {

        @Test
        @DisplayName("empty list → UNAVAILABLE")
        void emptyList() {
            exchange.json("[]");
            assertEquals(ProviderErrorKind.UNAVAILABLE, fetch().error());
        }

        @Test
        @DisplayName("401 → UNAUTHORIZED")
        void unauthorized() {
            exchange.status(HttpStatus.UNAUTHORIZED);
            assertEquals(ProviderErrorKind.UNAUTHORIZED, fetch().error());
        }

        @Test
        @DisplayName("429 → RATE_LIMITED")
        void rateLimited() {
            exchange.status(HttpStatus.TOO_MANY_REQUESTS);
            assertEquals(ProviderErrorKind.RATE_LIMITED, fetch().error());
        }

        @Test
        @DisplayName("503 → UNAVAILABLE")
        void serverError() {
            exchange.status(HttpStatus.SERVICE_UNAVAILABLE);
            assertEquals(ProviderErrorKind.UNAVAILABLE, fetch().error());
        }

        @Test
        @DisplayName("malformed JSON → PARSE_ERROR")
        void malformedJson() {
            exchange.json("[{\"bedrooms\": ");
            assertEquals(ProviderErrorKind.PARSE_ERROR, fetch().error());
        }

        @Test
        @DisplayName("object instead of list → PARSE_ERROR")
        void wrongShape() {
            exchange.json("{\"bedrooms\": 3}");
            assertEquals(ProviderErrorKind.PARSE_ERROR, fetch().error());
        }

        @Test
        @DisplayName("never signals onError, failure carries no data")
        void neverErrors() {
            exchange.status(HttpStatus.FORBIDDEN);

            StepVerifier.create(provider.fetchForProperty(ADDRESS))
                .assertNext(result -> {
                    assertFalse(result.isSuccess());
                    assertNull(result.patch());
                    assertNull(result.rawPayload());
                    assertEquals(ProviderOutcome.FAILED, result.metadata().outcome());
                })
                .verifyComplete();
        }
    }
}
