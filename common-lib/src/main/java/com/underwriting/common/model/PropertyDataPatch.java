package com.underwriting.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.Map;

/**
 * A partial set of property facts reported by one provider. Any subset of fields may be
 * present; absent fields are {@code null}.
 *
 * <p>Counts and money must be non-negative. Monetary values are rounded to cents.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PropertyDataPatch(
    Double  marketValueEstimate,
    Double  rentEstimate,
    Double  annualTaxes,
    Double  beds,
    Double  baths,
    Integer sqft,
    Integer lotSqft,
    Integer yearBuilt,
    Double  closingCostEstimate
) {
    public static final PropertyDataPatch EMPTY = PropertyDataPatch.builder().build();

    public PropertyDataPatch {
        marketValueEstimate = money("market_value_estimate", marketValueEstimate);
        rentEstimate        = money("rent_estimate", rentEstimate);
        annualTaxes         = money("annual_taxes", annualTaxes);
        closingCostEstimate = money("closing_cost_estimate", closingCostEstimate);
        requireNonNegative("beds", beds);
        requireNonNegative("baths", baths);
        requireNonNegative("sqft", sqft);
        requireNonNegative("lot_sqft", lotSqft);
        requireNonNegative("year_built", yearBuilt);
    }

    public Object get(PropertyField field) {
        return field.valueOf(this);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return Arrays.stream(PropertyField.values()).allMatch(f -> f.valueOf(this) == null);
    }

    /** Rebuilds a patch from per-field values, as produced by a field-by-field merge. */
    public static PropertyDataPatch fromValues(Map<PropertyField, Object> values) {
        return new PropertyDataPatch(
            (Double)  values.get(PropertyField.MARKET_VALUE_ESTIMATE),
            (Double)  values.get(PropertyField.RENT_ESTIMATE),
            (Double)  values.get(PropertyField.ANNUAL_TAXES),
            (Double)  values.get(PropertyField.BEDS),
            (Double)  values.get(PropertyField.BATHS),
            (Integer) values.get(PropertyField.SQFT),
            (Integer) values.get(PropertyField.LOT_SQFT),
            (Integer) values.get(PropertyField.YEAR_BUILT),
            (Double)  values.get(PropertyField.CLOSING_COST_ESTIMATE)
        );
    }

    private static Double money(String field, Double value) {
        requireNonNegative(field, value);
        if (value == null) {
            return null;
        }
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static void requireNonNegative(String field, Number value) {
        if (value != null && (value.doubleValue() < 0 || Double.isNaN(value.doubleValue()))) {
            throw new IllegalArgumentException(field + " cannot be negative, got " + value);
        }
    }
}
