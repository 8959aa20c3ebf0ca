package com.underwriting.propertydata.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.underwriting.common.model.AreaRentBenchmark;
import com.underwriting.common.model.NormalizedAddress;
import com.underwriting.common.model.PropertyDataPatch;
import com.underwriting.common.model.ProviderCapability;
import com.underwriting.common.model.ProviderResult;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rentometer rent summary. The same endpoint answers both scopes: the average (else the
 * median) becomes the property rent estimate, the median (else the average) with its
 * sample size becomes the ZIP benchmark.
 *
 * <p>Both scopes of one aggregation are fanned out together, so concurrent lookups for the
 * same address share a single in-flight {@code /summary} request. The request is cancelled
 * only once every subscriber has cancelled; a lookup that starts after it completed sends
 * a new one.
 */
public class RentometerProvider extends HttpPropertyProvider {

    public static final String ID = "rentometer";

    private final String apiKey;
    private final Map<String, Mono<String>> inFlight = new ConcurrentHashMap<>();

    public RentometerProvider(WebClient webClient, ObjectMapper objectMapper, Clock clock, String apiKey) {
        super(webClient, objectMapper, clock);
        this.apiKey = apiKey;
    }

    @Override
    public String providerId() {
        return ID;
    }

    @Override
    public Set<ProviderCapability> capabilities() {
        return Set.of(ProviderCapability.PROPERTY_LEVEL, ProviderCapability.AREA_LEVEL);
    }

    @Override
    public Mono<ProviderResult> fetchForProperty(NormalizedAddress address) {
        return propertyCall(address, sharedSummary(address), root -> {
            JsonNode summary = summaryNode(root);
            Double rent = JsonValues.firstDouble(summary, "average", "mean", "median");
            if (rent == null) {
                throw noData("summary has neither average nor median");
            }
            return PropertyDataPatch.builder().rentEstimate(rent).build();
        });
    }

    @Override
    public Mono<ProviderResult> fetchForArea(NormalizedAddress address) {
        return areaCall(address, sharedSummary(address), root -> {
            JsonNode summary = summaryNode(root);
            Double median = JsonValues.firstDouble(summary, "median", "average", "mean");
            if (median == null) {
                throw noData("summary has neither median nor average");
            }
            return AreaRentBenchmark.of(address.zip(), median,
                JsonValues.firstInt(summary, "samples", "sample_size"));
        });
    }

    private Mono<String> sharedSummary(NormalizedAddress address) {
        String key = address.cacheKey();
        return Mono.defer(() -> inFlight.computeIfAbsent(key, k -> summary(address)
            .doFinally(signal -> inFlight.remove(k))
            .share()));
    }

    private Mono<String> summary(NormalizedAddress address) {
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/summary")
                .queryParam("api_key", "{key}")
                .queryParam("address", "{address}")
                .build(apiKey, address.format()))
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .bodyToMono(String.class);
    }

    // Older API versions wrap the statistics in "data".
    private static JsonNode summaryNode(JsonNode root) {
        return root.has("data") ? root.path("data") : root;
    }
}
