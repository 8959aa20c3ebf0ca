package com.underwriting.common.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * A {@link ProviderResult} tagged with the precedence rank of the adapter that produced
 * it. Lower rank wins field conflicts.
 *
 * @param scope whether the result answers a property-level or an area-level call
 */
public record RankedProviderResult(int rank, ProviderCapability scope, ProviderResult result) {

    /** Rank ascending, then provider id, then property scope before area scope. */
    public static final Comparator<RankedProviderResult> PRECEDENCE =
        Comparator.comparingInt(RankedProviderResult::rank)
            .thenComparing(r -> r.result().providerId())
            .thenComparing(RankedProviderResult::scope);

    public RankedProviderResult {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(result, "result");
    }

    public static RankedProviderResult property(int rank, ProviderResult result) {
        return new RankedProviderResult(rank, ProviderCapability.PROPERTY_LEVEL, result);
    }

    public static RankedProviderResult area(int rank, ProviderResult result) {
        return new RankedProviderResult(rank, ProviderCapability.AREA_LEVEL, result);
    }

    public String providerId() {
        return result.providerId();
    }
}
