package com.underwriting.common.merge;

import com.underwriting.common.model.AreaRentBenchmark;
import com.underwriting.common.model.CanonicalPropertyData;
import com.underwriting.common.model.NormalizedAddress;
import com.underwriting.common.model.PropertyDataPatch;
import com.underwriting.common.model.PropertyField;
import com.underwriting.common.model.ProvenanceEntry;
import com.underwriting.common.model.ProviderCapability;
import com.underwriting.common.model.ProviderResult;
import com.underwriting.common.model.RankedProviderResult;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * First-writer-by-precedence merge.
 *
 * <p>Results are sorted by {@link RankedProviderResult#PRECEDENCE} before anything is
 * read, so the order in which responses arrived has no influence on the output. For each
 * field of {@link PropertyField}, the lowest-ranked successful provider with a non-null
 * value wins and is recorded in provenance; every later provider is ignored for that field.
 *
 * <p>Area benchmarks are resolved the same way but independently, and never touch the
 * property-level fields. The highest-precedence one becomes the headline; every benchmark
 * received is also kept by provider id. Every successful provider lands in {@code sources} and has its
 * raw payload kept in {@code meta}, whether or not it won any field.
 */
public final class PrecedenceMergeStrategy implements MergeEngine {

    @Override
    public CanonicalPropertyData merge(NormalizedAddress address, List<RankedProviderResult> results) {
        List<RankedProviderResult> ordered = results.stream()
            .sorted(RankedProviderResult.PRECEDENCE)
            .toList();
        List<RankedProviderResult> successes = ordered.stream()
            .filter(r -> r.result().isSuccess())
            .toList();
        if (successes.isEmpty()) {
            throw new IllegalArgumentException("merge requires at least one successful result for "
                + address.format());
        }

        List<ProvenanceEntry> provenance = new ArrayList<>();

        // ── property-level fields ──────────────────────────────────────────
        Map<PropertyField, Object> values = new EnumMap<>(PropertyField.class);
        for (PropertyField field : PropertyField.values()) {
            for (RankedProviderResult ranked : successes) {
                ProviderResult result = ranked.result();
                Object value = field.valueOf(result.patch());
                if (value != null) {
                    values.put(field, value);
                    provenance.add(ProvenanceEntry.selected(
                        field.key(), result.providerId(), result.metadata().fetchedAt()));
                    break;
                }
            }
        }

        // ── area benchmark (auxiliary, independent of the fields above) ────
        AreaRentBenchmark benchmark = null;
        Map<String, AreaRentBenchmark> rentBenchmarks = new HashMap<>();
        for (RankedProviderResult ranked : successes) {
            ProviderResult result = ranked.result();
            if (result.areaBenchmark() == null) {
                continue;
            }
            rentBenchmarks.putIfAbsent(result.providerId(), result.areaBenchmark());
            if (benchmark == null) {
                benchmark = result.areaBenchmark();
                provenance.add(ProvenanceEntry.selected(
                    ProvenanceEntry.AREA_BENCHMARK_FIELD, result.providerId(), result.metadata().fetchedAt()));
            }
        }

        // ── sources and raw payloads: every success, selected or not ───────
        Set<String> sources = new LinkedHashSet<>();
        Set<String> propertyScoped = new LinkedHashSet<>();
        for (RankedProviderResult ranked : successes) {
            sources.add(ranked.providerId());
            if (ranked.scope() == ProviderCapability.PROPERTY_LEVEL) {
                propertyScoped.add(ranked.providerId());
            }
        }
        Map<String, String> meta = new HashMap<>();
        for (RankedProviderResult ranked : successes) {
            String id = ranked.providerId();
            String key = ranked.scope() == ProviderCapability.AREA_LEVEL && propertyScoped.contains(id)
                ? CanonicalPropertyData.areaRawKey(id)
                : CanonicalPropertyData.rawKey(id);
            meta.putIfAbsent(key, ranked.result().rawPayload());
        }

        // ── failures, kept so a partial record is distinguishable ──────────
        for (RankedProviderResult ranked : ordered) {
            ProviderResult result = ranked.result();
            if (!result.isSuccess()) {
                provenance.add(ProvenanceEntry.failed(
                    result.providerId(), result.metadata().fetchedAt(), result.error()));
            }
        }

        return new CanonicalPropertyData(
            address, PropertyDataPatch.fromValues(values), benchmark, rentBenchmarks, provenance, sources, meta);
    }
}
