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
 * Estated property API. The token travels as a query parameter and the record sits under
 * {@code data}; a non-success {@code status} means the address was not matched.
 */
public class EstatedProvider extends HttpPropertyProvider {

    public static final String ID = "estated";

    private final String apiToken;

    public EstatedProvider(WebClient webClient, ObjectMapper objectMapper, Clock clock, String apiToken) {
        super(webClient, objectMapper, clock);
        this.apiToken = apiToken;
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
                .path("/property")
                .queryParam("token", "{token}")
                .queryParam("street_address", "{line1}")
                .queryParam("city", "{city}")
                .queryParam("state", "{state}")
                .queryParam("zip_code", "{zip}")
                .build(apiToken, address.line1(), address.city(), address.state(), address.zip()))
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .bodyToMono(String.class);
        return propertyCall(address, request, this::parseProperty);
    }

    private PropertyDataPatch parseProperty(JsonNode root) {
        String status = root.path("status").asText("");
        if (!status.isEmpty() && !"success".equalsIgnoreCase(status) && !"ok".equalsIgnoreCase(status)) {
            throw noData("status " + status);
        }
        JsonNode data = root.path("data");
        if (data.isMissingNode() || data.isNull()) {
            throw noData("no property found");
        }
        if (!data.isObject()) {
            throw new ProviderParseException(ID, "data is not an object");
        }

        JsonNode structure = data.path("structure");
        JsonNode land      = data.path("land");
        JsonNode valuation = data.path("valuation");
        JsonNode taxes     = data.path("taxes");
        JsonNode latestTax = taxes.isArray() && !taxes.isEmpty() ? taxes.get(0) : taxes;

        return PropertyDataPatch.builder()
            .beds(JsonValues.firstDouble(structure, "beds", "bedrooms", "total_bedrooms"))
            .baths(JsonValues.firstDouble(structure, "baths", "bathrooms", "total_bathrooms"))
            .sqft(JsonValues.firstInt(structure, "total_area_sq_ft", "total_square_feet", "living_area_sq_ft"))
            .yearBuilt(JsonValues.firstInt(structure, "year_built"))
            .lotSqft(JsonValues.firstInt(land, "area_sq_ft", "lot_square_feet"))
            .marketValueEstimate(marketValue(valuation))
            .rentEstimate(JsonValues.firstDouble(valuation.path("rent"), "estimate", "value"))
            .annualTaxes(JsonValues.firstDouble(latestTax, "amount", "total"))
            .build();
    }

    private static Double marketValue(JsonNode valuation) {
        Double market = JsonValues.firstDouble(valuation.path("market"), "estimate", "value");
        return market != null ? market : JsonValues.firstDouble(valuation, "value", "estimate");
    }
}
