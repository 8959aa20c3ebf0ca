package com.underwriting.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * The single merged record for one address. Immutable: every collection is an
 * unmodifiable copy with a fixed iteration order, so two records built from the same
 * inputs are equal and serialize identically.
 *
 * @param address        normalized identity of the property
 * @param fields         merged property-level values
 * @param areaBenchmark  headline area-level statistic from the highest-precedence area source
 * @param rentBenchmarks every area-level statistic received, by provider id, headline included
 * @param provenance     field entries in canonical field order, then failure entries
 * @param sources        ids of every provider that returned a success, in precedence order
 * @param meta           {@code "<providerId>_raw"} to raw payload, sorted by key
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CanonicalPropertyData(
    NormalizedAddress address,
    PropertyDataPatch fields,
    AreaRentBenchmark areaBenchmark,
    @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, AreaRentBenchmark> rentBenchmarks,
    List<ProvenanceEntry> provenance,
    Set<String> sources,
    Map<String, String> meta
) {
    public CanonicalPropertyData {
        Objects.requireNonNull(address, "address");
        fields         = fields != null ? fields : PropertyDataPatch.EMPTY;
        rentBenchmarks = rentBenchmarks != null
            ? Collections.unmodifiableMap(new TreeMap<>(rentBenchmarks))
            : Map.of();
        provenance     = provenance != null ? List.copyOf(provenance) : List.of();
        sources        = sources != null
            ? Collections.unmodifiableSet(new LinkedHashSet<>(sources))
            : Set.of();
        meta           = meta != null
            ? Collections.unmodifiableMap(new TreeMap<>(meta))
            : Map.of();
    }

    public Object get(PropertyField field) {
        return fields.get(field);
    }

    /** Provider whose value was kept for {@code field}, if the field is set. */
    public Optional<String> providerFor(PropertyField field) {
        return providerFor(field.key());
    }

    public Optional<String> providerFor(String fieldKey) {
        return provenance.stream()
            .filter(p -> !p.isFailure() && fieldKey.equals(p.field()))
            .map(ProvenanceEntry::providerId)
            .findFirst();
    }

    public List<ProvenanceEntry> fieldProvenance() {
        return provenance.stream().filter(p -> !p.isFailure()).toList();
    }

    public List<ProvenanceEntry> failedProviders() {
        return provenance.stream().filter(ProvenanceEntry::isFailure).toList();
    }

    /** True when at least one attempted provider failed. */
    @JsonIgnore
    public boolean isPartial() {
        return provenance.stream().anyMatch(ProvenanceEntry::isFailure);
    }

    public String rawPayload(String providerId) {
        return meta.get(rawKey(providerId));
    }

    public static String rawKey(String providerId) {
        return providerId + "_raw";
    }

    public static String areaRawKey(String providerId) {
        return providerId + "_area_raw";
    }
}
