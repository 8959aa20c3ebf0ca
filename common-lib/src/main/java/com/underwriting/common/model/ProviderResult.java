package com.underwriting.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of one adapter call. Either data is present (a property patch, an area
 * benchmark, or both) together with the raw payload it was parsed from, or an error
 * kind is present. Never both, never neither.
 */
public record ProviderResult(
    PropertyDataPatch patch,
    AreaRentBenchmark areaBenchmark,
    String rawPayload,
    ProviderMetadata metadata,
    ProviderErrorKind error
) {
    public ProviderResult {
        Objects.requireNonNull(metadata, "metadata");
        boolean hasData = patch != null || areaBenchmark != null;
        if (error != null && hasData) {
            throw new IllegalArgumentException(
                "provider " + metadata.providerId() + " reported both data and error " + error);
        }
        if (error == null && !hasData) {
            throw new IllegalArgumentException(
                "provider " + metadata.providerId() + " reported neither data nor an error");
        }
        if (error == null) {
            Objects.requireNonNull(rawPayload, "rawPayload of a successful result");
        }
        ProviderOutcome expected = error == null ? ProviderOutcome.SUCCESS : ProviderOutcome.FAILED;
        if (metadata.outcome() != expected) {
            throw new IllegalArgumentException(
                "metadata outcome " + metadata.outcome() + " contradicts result for " + metadata.providerId());
        }
    }

    public static ProviderResult property(String providerId, Instant fetchedAt, Duration latency,
                                          PropertyDataPatch patch, String rawPayload) {
        return new ProviderResult(patch, null, rawPayload,
            new ProviderMetadata(providerId, fetchedAt, latency, ProviderOutcome.SUCCESS), null);
    }

    public static ProviderResult area(String providerId, Instant fetchedAt, Duration latency,
                                      AreaRentBenchmark benchmark, String rawPayload) {
        return new ProviderResult(null, benchmark, rawPayload,
            new ProviderMetadata(providerId, fetchedAt, latency, ProviderOutcome.SUCCESS), null);
    }

    public static ProviderResult failure(String providerId, Instant fetchedAt, Duration latency,
                                         ProviderErrorKind error) {
        return new ProviderResult(null, null, null,
            new ProviderMetadata(providerId, fetchedAt, latency, ProviderOutcome.FAILED),
            Objects.requireNonNull(error, "error"));
    }

    public String providerId() {
        return metadata.providerId();
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null;
    }
}
