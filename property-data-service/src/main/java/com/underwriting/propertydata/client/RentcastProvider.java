package com.underwriting.propertydata.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.underwriting.common.model.NormalizedAddress;
import com.underwriting.common.model.PropertyDataPatch;
import com.underwriting.common.model.ProviderCapability;
import com.underwriting.common.model.ProviderResult;
import com.underwriting.propertydata.provider.ProviderParseException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Set;

/**
 * Rentcast property records. Supplies structure facts, the latest tax assessment as the
 * market value, and the latest tax bill. The properties endpoint carries no rent estimate.
 */
public class RentcastProvider extends HttpPropertyProvider {

    public static final String ID = "rentcast";

    private final String apiKey;

    public RentcastProvider(WebClient webClient, ObjectMapper objectMapper, Clock clock, String apiKey) {
        super(webClient, objectMapper, clock);
        this.apiKey = apiKey;
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
        Mono<String> request = webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/properties")
                .queryParam("address", "{address}")
                .build(address.format()))
            .header("X-Api-Key", apiKey)
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .bodyToMono(String.class);
        return propertyCall(address, request, this::parseProperty);
    }

    private PropertyDataPatch parseProperty(JsonNode root) {
        if (!root.isArray()) {
            throw new ProviderParseException(ID, "expected a list of properties, got " + root.getNodeType());
        }
        if (root.isEmpty()) {
            throw noData("no property found");
        }
        JsonNode property = root.get(0);
        JsonNode assessment = JsonValues.latestByYear(property.path("taxAssessments"));
        JsonNode taxes      = JsonValues.latestByYear(property.path("propertyTaxes"));

        return PropertyDataPatch.builder()
            .beds(JsonValues.firstDouble(property, "bedrooms"))
            .baths(JsonValues.firstDouble(property, "bathrooms"))
            .sqft(JsonValues.firstInt(property, "squareFootage"))
            .lotSqft(JsonValues.firstInt(property, "lotSize"))
            .yearBuilt(JsonValues.firstInt(property, "yearBuilt"))
            .marketValueEstimate(JsonValues.firstDouble(assessment, "value"))
            .annualTaxes(JsonValues.firstDouble(taxes, "total"))
            .build();
    }
}
