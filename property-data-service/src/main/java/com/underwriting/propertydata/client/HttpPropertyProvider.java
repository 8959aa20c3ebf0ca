package com.underwriting.propertydata.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.underwriting.common.model.AreaRentBenchmark;
import com.underwriting.common.model.NormalizedAddress;
import com.underwriting.common.model.PropertyDataPatch;
import com.underwriting.common.model.ProviderErrorKind;
import com.underwriting.common.model.ProviderResult;
import com.underwriting.propertydata.provider.PropertyDataProvider;
import com.underwriting.propertydata.provider.ProviderCallException;
import com.underwriting.propertydata.provider.ProviderErrors;
import com.underwriting.propertydata.provider.ProviderParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Shared plumbing for adapters that talk JSON over HTTP through a {@link WebClient}.
 *
 * <p>Subclasses build the request and a parser for the decoded body; this class times the
 * call, keeps the raw body, and turns every failure (HTTP status, transport, decoding,
 * unexpected payload shape) into a failed {@link ProviderResult}. Nothing escapes as an
 * error signal.
 */
public abstract class HttpPropertyProvider implements PropertyDataProvider {

    private static final Logger log = LoggerFactory.getLogger(HttpPropertyProvider.class);

    protected final WebClient webClient;
    protected final Clock clock;
    private final ObjectMapper objectMapper;

    protected HttpPropertyProvider(WebClient webClient, ObjectMapper objectMapper, Clock clock) {
        this.webClient    = webClient;
        this.objectMapper = objectMapper;
        this.clock        = clock;
    }

    @FunctionalInterface
    protected interface PayloadParser<T> {
        /** May throw {@link ProviderCallException} to report "no data" or a known bad shape. */
        T parse(JsonNode root);
    }

    @FunctionalInterface
    private interface ResultAssembler {
        ProviderResult assemble(JsonNode root, String raw, Instant fetchedAt, Duration latency);
    }

    protected final Mono<ProviderResult> propertyCall(NormalizedAddress address, Mono<String> request,
                                                      PayloadParser<PropertyDataPatch> parser) {
        return execute(address, "property", request, (root, raw, fetchedAt, latency) ->
            ProviderResult.property(providerId(), fetchedAt, latency, parser.parse(root), raw));
    }

    protected final Mono<ProviderResult> areaCall(NormalizedAddress address, Mono<String> request,
                                                  PayloadParser<AreaRentBenchmark> parser) {
        return execute(address, "area", request, (root, raw, fetchedAt, latency) ->
            ProviderResult.area(providerId(), fetchedAt, latency, parser.parse(root), raw));
    }

    protected final ProviderCallException noData(String reason) {
        return new ProviderCallException(providerId(), ProviderErrorKind.UNAVAILABLE, reason);
    }

    private Mono<ProviderResult> execute(NormalizedAddress address, String scope, Mono<String> request,
                                         ResultAssembler assembler) {
        return Mono.defer(() -> {
            Instant started = clock.instant();
            return request
                .switchIfEmpty(Mono.error(() -> noData("empty response body")))
                .map(raw -> {
                    Instant fetchedAt = clock.instant();
                    JsonNode root = readTree(raw);
                    try {
                        return assembler.assemble(root, raw, fetchedAt, Duration.between(started, fetchedAt));
                    } catch (ProviderCallException e) {
                        throw e;
                    } catch (RuntimeException e) {
                        throw new ProviderParseException(providerId(), "unexpected " + scope + " payload", e);
                    }
                })
                .doOnNext(result -> log.info("Provider call succeeded. provider={} scope={} latencyMs={}",
                    providerId(), scope, result.metadata().latency().toMillis()))
                .onErrorResume(e -> {
                    ProviderErrorKind kind = ProviderErrors.classify(e);
                    Instant failedAt = clock.instant();
                    log.warn("Provider call failed. provider={} scope={} address={} error={} reason={}",
                        providerId(), scope, address.format(), kind, e.getMessage());
                    return Mono.just(ProviderResult.failure(
                        providerId(), failedAt, Duration.between(started, failedAt), kind));
                });
        });
    }

    private JsonNode readTree(String raw) {
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new ProviderParseException(providerId(), "response is not valid JSON", e);
        }
    }
}
