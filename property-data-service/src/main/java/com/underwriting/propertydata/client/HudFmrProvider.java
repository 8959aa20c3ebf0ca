package com.underwriting.propertydata.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.underwriting.common.model.AreaRentBenchmark;
import com.underwriting.common.model.NormalizedAddress;
import com.underwriting.common.model.ProviderCapability;
import com.underwriting.common.model.ProviderResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * HUD Fair Market Rents by ZIP. Open data, so the API key is optional.
 *
 * <p>FMR tables change once a year, so successful lookups are kept per ZIP for
 * {@code cacheTtl}, at most {@code maxCachedZips} of them (oldest fetch evicted first,
 * non-positive means unbounded). Expired tables are dropped when next read. The headline {@code medianRent} is the median across the bedroom
 * counts HUD publishes for the area.
 */
public class HudFmrProvider extends HttpPropertyProvider {

    private static final Logger log = LoggerFactory.getLogger(HudFmrProvider.class);

    public static final String ID = "hud_fmr";

    private static final Map<String, Integer> NAMED_BEDROOMS = Map.of(
        "efficiency", 0,
        "one-bedroom", 1,
        "two-bedroom", 2,
        "three-bedroom", 3,
        "four-bedroom", 4);

    private final String apiKey;
    private final Duration cacheTtl;
    private final int maxCachedZips;
    private final Map<String, ProviderResult> byZip = new ConcurrentHashMap<>();

    public HudFmrProvider(WebClient webClient, ObjectMapper objectMapper, Clock clock,
                          String apiKey, Duration cacheTtl, int maxCachedZips) {
        super(webClient, objectMapper, clock);
        this.apiKey        = apiKey;
        this.cacheTtl      = cacheTtl;
        this.maxCachedZips = maxCachedZips;
    }

    @Override
    public String providerId() {
        return ID;
    }

    @Override
    public Set<ProviderCapability> capabilities() {
        return Set.of(ProviderCapability.AREA_LEVEL);
    }

    @Override
    public Mono<ProviderResult> fetchForArea(NormalizedAddress address) {
        String zip = address.zip();
        return Mono.defer(() -> {
            ProviderResult cached = byZip.get(zip);
            if (cached != null) {
                if (clock.instant().isBefore(cached.metadata().fetchedAt().plus(cacheTtl))) {
                    log.debug("FMR_CACHE_HIT zip={}", zip);
                    return Mono.just(cached);
                }
                byZip.remove(zip, cached);
                log.debug("FMR_CACHE_EXPIRED zip={} fetchedAt={}", zip, cached.metadata().fetchedAt());
            }
            return areaCall(address, request(address), root -> parse(zip, root))
                .doOnNext(result -> {
                    if (result.isSuccess()) {
                        remember(zip, result);
                    }
                });
        });
    }

    /** ZIP tables currently held, expired ones not yet read again included. */
    int cachedZipCount() {
        return byZip.size();
    }

    private void remember(String zip, ProviderResult result) {
        byZip.put(zip, result);
        if (maxCachedZips <= 0) {
            return;
        }
        while (byZip.size() > maxCachedZips) {
            Optional<Map.Entry<String, ProviderResult>> oldest = byZip.entrySet().stream()
                .filter(e -> !e.getKey().equals(zip))
                .min(Comparator.comparing(e -> e.getValue().metadata().fetchedAt()));
            if (oldest.isEmpty()) {
                return;
            }
            if (byZip.remove(oldest.get().getKey(), oldest.get().getValue())) {
                log.debug("FMR_CACHE_EVICT zip={}", oldest.get().getKey());
            }
        }
    }

    private Mono<String> request(NormalizedAddress address) {
        WebClient.RequestHeadersSpec<?> spec = webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/fmr")
                .queryParam("zip", "{zip}")
                .build(address.zip()))
            .accept(MediaType.APPLICATION_JSON);
        if (apiKey != null && !apiKey.isBlank()) {
            spec = spec.header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        return spec.retrieve().bodyToMono(String.class);
    }

    private AreaRentBenchmark parse(String zip, JsonNode root) {
        JsonNode body = root.has("data") ? root.path("data") : root;
        JsonNode table = body.has("fmr") ? body.path("fmr")
            : body.has("fmr_values") ? body.path("fmr_values")
            : body.path("basicdata");

        Map<Integer, Double> bedroomRents = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = table.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            Integer bedrooms = bedroomCount(entry.getKey());
            Double rent = JsonValues.asDouble(entry.getValue());
            if (bedrooms != null && rent != null) {
                bedroomRents.put(bedrooms, rent);
            }
        }
        if (bedroomRents.isEmpty()) {
            throw noData("no fair market rents for zip " + zip);
        }
        return new AreaRentBenchmark(zip, median(new ArrayList<>(bedroomRents.values())), null,
            JsonValues.firstInt(body, "year"), bedroomRents);
    }

    private static Integer bedroomCount(String key) {
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        if (normalized.matches("\\d+")) {
            return Integer.parseInt(normalized);
        }
        return NAMED_BEDROOMS.get(normalized);
    }

    static double median(List<Double> values) {
        Collections.sort(values);
        int mid = values.size() / 2;
        double median = values.size() % 2 == 1
            ? values.get(mid)
            : (values.get(mid - 1) + values.get(mid)) / 2.0;
        return Math.round(median * 100.0) / 100.0;
    }
}
