package com.underwriting.propertydata.cache;

import com.underwriting.common.model.CanonicalPropertyData;

import java.time.Instant;

/**
 * Cache entry: the merged record for one address plus the moment it was stored.
 * Expiry is measured from {@code insertedAt}, not from the providers' fetch times.
 */
public record CachedPropertyData(
    String key,
    CanonicalPropertyData data,
    Instant insertedAt
) {}
