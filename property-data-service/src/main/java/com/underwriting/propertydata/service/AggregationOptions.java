package com.underwriting.propertydata.service;

/**
 * Per-request switches for optional lookups.
 *
 * @param includeAreaBenchmarks also call area-level adapters (ZIP rent benchmarks)
 * @param includeComps          also call comparable-listing adapters, when one is registered
 */
public record AggregationOptions(boolean includeAreaBenchmarks, boolean includeComps) {

    private static final AggregationOptions DEFAULTS = new AggregationOptions(true, true);

    public static AggregationOptions defaults() {
        return DEFAULTS;
    }

    public static AggregationOptions propertyOnly() {
        return new AggregationOptions(false, false);
    }
}
