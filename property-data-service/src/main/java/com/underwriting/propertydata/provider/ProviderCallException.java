package com.underwriting.propertydata.provider;

import com.underwriting.common.model.ProviderErrorKind;

/**
 * Internal signal raised inside an adapter's reactive chain and converted into a
 * failed {@code ProviderResult} before it leaves the adapter.
 */
public class ProviderCallException extends RuntimeException {

    private final String providerId;
    private final ProviderErrorKind kind;

    public ProviderCallException(String providerId, ProviderErrorKind kind, String message) {
        super("[" + providerId + "] " + message);
        this.providerId = providerId;
        this.kind = kind;
    }

    public ProviderCallException(String providerId, ProviderErrorKind kind, String message, Throwable cause) {
        super("[" + providerId + "] " + message, cause);
        this.providerId = providerId;
        this.kind = kind;
    }

    public String getProviderId() {
        return providerId;
    }

    public ProviderErrorKind getKind() {
        return kind;
    }
}
