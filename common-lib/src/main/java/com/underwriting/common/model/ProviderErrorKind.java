package com.underwriting.common.model;

/**
 * Closed set of failure modes a provider call can resolve to.
 */
public enum ProviderErrorKind {
    TIMEOUT,
    UNAUTHORIZED,
    RATE_LIMITED,
    UNAVAILABLE,
    PARSE_ERROR;

    /** Only transient conditions are worth another attempt. */
    public boolean isRetryable() {
        return this == TIMEOUT || this == RATE_LIMITED;
    }

    /**
     * Maps an HTTP error status to the failure it represents.
     * 401/403 → UNAUTHORIZED, 408 → TIMEOUT, 429 → RATE_LIMITED, anything else → UNAVAILABLE.
     */
    public static ProviderErrorKind fromHttpStatus(int status) {
        return switch (status) {
            case 401, 403 -> UNAUTHORIZED;
            case 408      -> TIMEOUT;
            case 429      -> RATE_LIMITED;
            default       -> UNAVAILABLE;
        };
    }
}
