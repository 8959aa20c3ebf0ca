package com.underwriting.common.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Bookkeeping attached to every provider call, successful or not.
 */
public record ProviderMetadata(
    String providerId,
    Instant fetchedAt,
    Duration latency,
    ProviderOutcome outcome
) {
    public ProviderMetadata {
        Objects.requireNonNull(providerId, "providerId");
        Objects.requireNonNull(fetchedAt, "fetchedAt");
        Objects.requireNonNull(outcome, "outcome");
        latency = latency != null ? latency : Duration.ZERO;
    }
}
