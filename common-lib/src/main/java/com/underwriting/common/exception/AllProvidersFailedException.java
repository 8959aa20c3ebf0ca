package com.underwriting.common.exception;

import com.underwriting.common.model.NormalizedAddress;
import com.underwriting.common.model.ProvenanceEntry;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when every candidate provider of an aggregation failed. Carries one failure
 * entry per attempted provider so callers can tell which sources were tried.
 */
public class AllProvidersFailedException extends AggregationException {

    private final NormalizedAddress address;
    private final List<ProvenanceEntry> failures;

    public AllProvidersFailedException(NormalizedAddress address, List<ProvenanceEntry> failures) {
        super("All providers failed for " + address.format() + ": " + describe(failures));
        this.address  = address;
        this.failures = List.copyOf(failures);
    }

    public NormalizedAddress getAddress() {
        return address;
    }

    public List<ProvenanceEntry> getFailures() {
        return failures;
    }

    private static String describe(List<ProvenanceEntry> failures) {
        if (failures.isEmpty()) {
            return "no candidate providers";
        }
        return failures.stream()
            .map(f -> f.providerId() + "=" + f.error())
            .collect(Collectors.joining(", "));
    }
}
