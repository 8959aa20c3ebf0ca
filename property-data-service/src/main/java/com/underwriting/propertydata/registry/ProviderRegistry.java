package com.underwriting.propertydata.registry;

import com.underwriting.common.model.ProviderCapability;
import com.underwriting.propertydata.provider.PropertyDataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Immutable, ranked set of the adapters usable in this process.
 *
 * <p>Ranks follow {@link ProviderTier} order and, inside a tier, registration order. The
 * fallback adapter is kept only when no live property-level adapter was registered; with
 * the fallback disabled, a registry with no adapters at all cannot be built.
 */
public final class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final List<RegisteredProvider> providers;
    private final boolean mockOnly;

    private ProviderRegistry(List<RegisteredProvider> providers, boolean mockOnly) {
        this.providers = List.copyOf(providers);
        this.mockOnly  = mockOnly;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** All adapters in rank order. */
    public List<RegisteredProvider> all() {
        return providers;
    }

    public List<RegisteredProvider> propertyLevel() {
        return providers.stream().filter(p -> p.supports(ProviderCapability.PROPERTY_LEVEL)).toList();
    }

    public List<RegisteredProvider> areaLevel() {
        return providers.stream().filter(p -> p.supports(ProviderCapability.AREA_LEVEL)).toList();
    }

    public OptionalInt rankOf(String providerId) {
        return providers.stream()
            .filter(p -> p.providerId().equals(providerId))
            .mapToInt(RegisteredProvider::rank)
            .findFirst();
    }

    public boolean isMockOnly() {
        return mockOnly;
    }

    public int size() {
        return providers.size();
    }

    public static final class Builder {

        private record Candidate(PropertyDataProvider provider, ProviderTier tier, Duration timeout, int order) {}

        private final List<Candidate> candidates = new ArrayList<>();
        private final Set<String> ids = new HashSet<>();
        private Candidate fallback;
        private boolean useFallbackIfUnconfigured = true;

        private Builder() {}

        public Builder register(PropertyDataProvider provider, ProviderTier tier, Duration timeout) {
            Objects.requireNonNull(provider, "provider");
            if (tier == ProviderTier.FALLBACK) {
                throw new IllegalArgumentException("use fallback() to register " + provider.providerId());
            }
            if (!ids.add(provider.providerId())) {
                throw new IllegalArgumentException("duplicate provider id " + provider.providerId());
            }
            candidates.add(new Candidate(provider, tier, timeout, candidates.size()));
            return this;
        }

        public Builder fallback(PropertyDataProvider provider, Duration timeout) {
            this.fallback = new Candidate(Objects.requireNonNull(provider, "provider"),
                ProviderTier.FALLBACK, timeout, Integer.MAX_VALUE);
            return this;
        }

        public Builder useFallbackIfUnconfigured(boolean enabled) {
            this.useFallbackIfUnconfigured = enabled;
            return this;
        }

        public ProviderRegistry build() {
            boolean anyPropertyLevel = candidates.stream()
                .anyMatch(c -> c.provider().supports(ProviderCapability.PROPERTY_LEVEL));

            if (!anyPropertyLevel && useFallbackIfUnconfigured && fallback != null) {
                log.warn("No live property provider configured, serving mock data only. provider={}",
                    fallback.provider().providerId());
                return new ProviderRegistry(
                    List.of(new RegisteredProvider(fallback.provider(), 0, ProviderTier.FALLBACK, fallback.timeout())),
                    true);
            }
            if (candidates.isEmpty()) {
                throw new IllegalStateException(
                    "No property data provider is configured and the mock fallback is disabled");
            }

            List<Candidate> ordered = new ArrayList<>(candidates);
            ordered.sort(Comparator.comparing(Candidate::tier).thenComparingInt(Candidate::order));

            List<RegisteredProvider> ranked = new ArrayList<>(ordered.size());
            for (int rank = 0; rank < ordered.size(); rank++) {
                Candidate c = ordered.get(rank);
                ranked.add(new RegisteredProvider(c.provider(), rank, c.tier(), c.timeout()));
            }
            log.info("Provider registry built. providers={}",
                ranked.stream().map(p -> p.providerId() + "#" + p.rank() + ":" + p.tier()).toList());
            return new ProviderRegistry(ranked, false);
        }
    }
}
