package com.underwriting.common.model;

import java.util.function.Function;

/**
 * The canonical property-level schema. Declaration order is the order in which the merge
 * walks fields and therefore the order of field provenance on a merged record.
 */
public enum PropertyField {
    MARKET_VALUE_ESTIMATE("market_value_estimate", PropertyDataPatch::marketValueEstimate),
    RENT_ESTIMATE("rent_estimate", PropertyDataPatch::rentEstimate),
    ANNUAL_TAXES("annual_taxes", PropertyDataPatch::annualTaxes),
    BEDS("beds", PropertyDataPatch::beds),
    BATHS("baths", PropertyDataPatch::baths),
    SQFT("sqft", PropertyDataPatch::sqft),
    LOT_SQFT("lot_sqft", PropertyDataPatch::lotSqft),
    YEAR_BUILT("year_built", PropertyDataPatch::yearBuilt),
    CLOSING_COST_ESTIMATE("closing_cost_estimate", PropertyDataPatch::closingCostEstimate);

    private final String key;
    private final Function<PropertyDataPatch, Object> accessor;

    PropertyField(String key, Function<PropertyDataPatch, Object> accessor) {
        this.key      = key;
        this.accessor = accessor;
    }

    /** Snake-case name used in provenance entries and persisted documents. */
    public String key() {
        return key;
    }

    public Object valueOf(PropertyDataPatch patch) {
        return patch == null ? null : accessor.apply(patch);
    }
}
