package com.underwriting.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Rent statistic scoped to an area (ZIP or metro) rather than to one property.
 * Kept apart from the property-level fields; it never overrides {@code rent_estimate}.
 *
 * @param areaKey      ZIP or metro label the figure applies to
 * @param medianRent   headline monthly rent for the area
 * @param sampleSize   number of listings behind the figure, when the source reports it
 * @param year         data vintage, when the source reports it
 * @param bedroomRents rent by bedroom count, when the source breaks it down
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AreaRentBenchmark(
    String areaKey,
    double medianRent,
    Integer sampleSize,
    Integer year,
    Map<Integer, Double> bedroomRents
) {
    public AreaRentBenchmark {
        Objects.requireNonNull(areaKey, "areaKey");
        if (medianRent < 0 || Double.isNaN(medianRent)) {
            throw new IllegalArgumentException("medianRent cannot be negative, got " + medianRent);
        }
        bedroomRents = bedroomRents == null
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(bedroomRents));
    }

    public static AreaRentBenchmark of(String areaKey, double medianRent, Integer sampleSize) {
        return new AreaRentBenchmark(areaKey, medianRent, sampleSize, null, Map.of());
    }
}
