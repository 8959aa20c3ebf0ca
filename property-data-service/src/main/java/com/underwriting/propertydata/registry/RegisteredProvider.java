package com.underwriting.propertydata.registry;

import com.underwriting.common.model.ProviderCapability;
import com.underwriting.propertydata.provider.PropertyDataProvider;

import java.time.Duration;
import java.util.Objects;

/**
 * An adapter as the registry ranks it. Lower {@code rank} wins field conflicts.
 */
public record RegisteredProvider(
    PropertyDataProvider provider,
    int rank,
    ProviderTier tier,
    Duration timeout
) {
    public RegisteredProvider {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive for " + provider.providerId());
        }
    }

    public String providerId() {
        return provider.providerId();
    }

    public boolean supports(ProviderCapability capability) {
        return provider.supports(capability);
    }
}
