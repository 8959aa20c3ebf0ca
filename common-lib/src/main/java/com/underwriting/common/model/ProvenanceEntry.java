package com.underwriting.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Objects;

/**
 * One line of a merged record's audit trail.
 *
 * <p>A field entry ({@code outcome = SUCCESS}) names the provider whose value was kept for
 * {@code field}. A failure entry ({@code field = null}, {@code outcome = FAILED}) records a
 * provider that was asked and did not answer usefully.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProvenanceEntry(
    String field,
    String providerId,
    Instant timestamp,
    ProviderOutcome outcome,
    ProviderErrorKind error
) {
    public static final String AREA_BENCHMARK_FIELD = "area_benchmark";

    public ProvenanceEntry {
        Objects.requireNonNull(providerId, "providerId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(outcome, "outcome");
    }

    public static ProvenanceEntry selected(String field, String providerId, Instant timestamp) {
        return new ProvenanceEntry(Objects.requireNonNull(field, "field"), providerId, timestamp,
            ProviderOutcome.SUCCESS, null);
    }

    public static ProvenanceEntry failed(String providerId, Instant timestamp, ProviderErrorKind error) {
        return new ProvenanceEntry(null, providerId, timestamp, ProviderOutcome.FAILED,
            Objects.requireNonNull(error, "error"));
    }

    @JsonIgnore
    public boolean isFailure() {
        return outcome == ProviderOutcome.FAILED;
    }
}
