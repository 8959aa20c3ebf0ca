package com.underwriting.propertydata.provider;

import com.underwriting.common.model.NormalizedAddress;
import com.underwriting.common.model.ProviderCapability;
import com.underwriting.common.model.ProviderErrorKind;
import com.underwriting.common.model.ProviderResult;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * Extension point for a property-information source: live HTTP adapters or the
 * deterministic mock.
 *
 * <p>Implementations must never signal {@code onError}. Every transport, status or parse
 * failure resolves to {@link ProviderResult#failure}. Time limits belong to the caller,
 * which applies them with {@code timeout} and cancels the subscription when they elapse;
 * implementations must release their in-flight request on cancellation.
 */
public interface PropertyDataProvider {

    String providerId();

    Set<ProviderCapability> capabilities();

    /**
     * Property-scoped lookup. Only called for providers declaring
     * {@link ProviderCapability#PROPERTY_LEVEL}; the default reports the source as unavailable.
     */
    default Mono<ProviderResult> fetchForProperty(NormalizedAddress address) {
        return unsupported();
    }

    /**
     * Area-scoped lookup. Only called for providers declaring
     * {@link ProviderCapability#AREA_LEVEL}; the default reports the source as unavailable.
     */
    default Mono<ProviderResult> fetchForArea(NormalizedAddress address) {
        return unsupported();
    }

    default boolean supports(ProviderCapability capability) {
        return capabilities().contains(capability);
    }

    private Mono<ProviderResult> unsupported() {
        return Mono.fromSupplier(() -> ProviderResult.failure(
            providerId(), Instant.now(), Duration.ZERO, ProviderErrorKind.UNAVAILABLE));
    }
}
