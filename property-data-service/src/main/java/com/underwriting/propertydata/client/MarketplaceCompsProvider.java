package com.underwriting.propertydata.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.underwriting.common.model.NormalizedAddress;
import com.underwriting.common.model.PropertyDataPatch;
import com.underwriting.common.model.ProviderCapability;
import com.underwriting.common.model.ProviderResult;
import com.underwriting.common.trace.AggregationContext;
import com.underwriting.propertydata.provider.DeadlineAwareRetry;
import com.underwriting.propertydata.provider.ProviderParseException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Rental comparables marketplace. The rent estimate is the mean rent of the first
 * {@code maxResults} comparables returned.
 *
 * <p>The only retrying adapter: each attempt is bounded by {@code attemptTimeout}, and
 * timeouts or rate limits are retried with exponential backoff until the aggregation
 * deadline carried in the Reactor context would be overrun.
 */
public class MarketplaceCompsProvider extends HttpPropertyProvider {

    public static final String ID = "marketplace_comps";

    private final String apiKey;
    private final Duration attemptTimeout;
    private final int maxResults;
    private final int maxRetries;
    private final Duration backoff;

    public MarketplaceCompsProvider(WebClient webClient, ObjectMapper objectMapper, Clock clock,
                                    String apiKey, Duration attemptTimeout, int maxResults,
                                    int maxRetries, Duration backoff) {
        super(webClient, objectMapper, clock);
        this.apiKey         = apiKey;
        this.attemptTimeout = attemptTimeout;
        this.maxResults     = maxResults;
        this.maxRetries     = maxRetries;
        this.backoff        = backoff;
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
        Mono<String> request = Mono.deferContextual(ctx -> attempt(address)
            .timeout(attemptTimeout)
            .retryWhen(DeadlineAwareRetry.backoff(ID, maxRetries, backoff,
                AggregationContext.deadline(ctx).orElse(null), clock)));
        return propertyCall(address, request, this::parseComps);
    }

    private Mono<String> attempt(NormalizedAddress address) {
        Map<String, Object> body = Map.of(
            "line1", address.line1(),
            "city",  address.city(),
            "state", address.state(),
            "zip",   address.zip(),
            "limit", maxResults);

        WebClient.RequestBodySpec spec = webClient.post()
            .uri("/comps")
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON);
        if (apiKey != null && !apiKey.isBlank()) {
            spec = spec.header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        return spec.bodyValue(body).retrieve().bodyToMono(String.class);
    }

    private PropertyDataPatch parseComps(JsonNode root) {
        JsonNode comps = root.isArray() ? root : root.path("results");
        if (!comps.isArray()) {
            throw new ProviderParseException(ID, "expected a list of comparables");
        }
        double total = 0;
        int counted = 0;
        for (JsonNode comp : comps) {
            if (counted >= maxResults) {
                break;
            }
            Double rent = JsonValues.firstDouble(comp, "rent", "price");
            if (rent != null) {
                total += rent;
                counted++;
            }
        }
        if (counted == 0) {
            throw noData("no comparables with a rent");
        }
        return PropertyDataPatch.builder().rentEstimate(total / counted).build();
    }
}
