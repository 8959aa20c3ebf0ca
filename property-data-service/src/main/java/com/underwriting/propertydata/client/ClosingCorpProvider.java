package com.underwriting.propertydata.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.underwriting.common.model.NormalizedAddress;
import com.underwriting.common.model.PropertyDataPatch;
import com.underwriting.common.model.ProviderCapability;
import com.underwriting.common.model.ProviderResult;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;
import java.util.Set;

/** ClosingCorp closing-cost quote. Supplies only {@code closing_cost_estimate}. */
public class ClosingCorpProvider extends HttpPropertyProvider {

    public static final String ID = "closingcorp";

    private final String apiKey;

    public ClosingCorpProvider(WebClient webClient, ObjectMapper objectMapper, Clock clock, String apiKey) {
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
        Map<String, Object> body = Map.of("property_address", Map.of(
            "line1", address.line1(),
            "city",  address.city(),
            "state", address.state(),
            "zip",   address.zip()));

        Mono<String> request = webClient.post()
            .uri("/closing-costs")
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(String.class);

        return propertyCall(address, request, root -> {
            JsonNode costs = root.path("closing_costs");
            Double estimate = JsonValues.firstDouble(costs, "estimate", "total");
            if (estimate == null) {
                throw noData("quote carries no closing cost estimate");
            }
            return PropertyDataPatch.builder().closingCostEstimate(estimate).build();
        });
    }
}
