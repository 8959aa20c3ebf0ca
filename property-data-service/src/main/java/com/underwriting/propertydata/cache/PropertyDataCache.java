package com.underwriting.propertydata.cache;

import com.underwriting.common.model.CanonicalPropertyData;
import com.underwriting.common.model.NormalizedAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory cache of merged records, one per normalized address.
 *
 * <p>An entry is served while {@code now - insertedAt < ttl}; expired entries are evicted
 * on read. When {@code maxEntries} is positive and an insert pushes the cache past it, the
 * oldest insertion is dropped. Only successful aggregations are ever stored.
 *
 * <p>Thread-safe via {@link ConcurrentHashMap}; concurrent puts for one key resolve to
 * last-writer-wins, and both writers hold equally valid records.
 */
@Component
public class PropertyDataCache {

    private static final Logger log = LoggerFactory.getLogger(PropertyDataCache.class);

    private final ConcurrentHashMap<String, CachedPropertyData> store = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;

    @Autowired
    public PropertyDataCache(@Value("${aggregation.cache.ttl-minutes:60}") long ttlMinutes,
                             @Value("${aggregation.cache.max-entries:10000}") int maxEntries,
                             Clock clock) {
        this(Duration.ofMinutes(ttlMinutes), maxEntries, clock);
    }

    public PropertyDataCache(Duration ttl, int maxEntries, Clock clock) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("cache ttl must be positive, got " + ttl);
        }
        this.ttl        = ttl;
        this.maxEntries = maxEntries;
        this.clock      = clock;
    }

    public Optional<CanonicalPropertyData> get(NormalizedAddress address) {
        String key = address.cacheKey();
        CachedPropertyData entry = store.get(key);
        if (entry == null) {
            log.info("CACHE_MISS address={}", address.format());
            return Optional.empty();
        }
        if (isExpired(entry)) {
            store.remove(key, entry);
            log.info("CACHE_MISS address={} reason=expired insertedAt={}", address.format(), entry.insertedAt());
            return Optional.empty();
        }
        log.info("CACHE_HIT address={} insertedAt={} sources={}",
            address.format(), entry.insertedAt(), entry.data().sources());
        return Optional.of(entry.data());
    }

    public void put(NormalizedAddress address, CanonicalPropertyData data) {
        String key = address.cacheKey();
        store.put(key, new CachedPropertyData(key, data, clock.instant()));
        log.info("CACHE_REFRESH address={} ttlMinutes={} sources={}", address.format(), ttl.toMinutes(), data.sources());
        evictOverflow();
    }

    public void invalidate(NormalizedAddress address) {
        if (store.remove(address.cacheKey()) != null) {
            log.info("CACHE_INVALIDATE address={}", address.format());
        }
    }

    /** Entries currently held, expired ones not yet evicted included. */
    public int size() {
        return store.size();
    }

    public void clear() {
        store.clear();
    }

    boolean isExpired(CachedPropertyData entry) {
        return !clock.instant().isBefore(entry.insertedAt().plus(ttl));
    }

    private void evictOverflow() {
        if (maxEntries <= 0) {
            return;
        }
        while (store.size() > maxEntries) {
            Optional<CachedPropertyData> oldest = store.values().stream()
                .min(Comparator.comparing(CachedPropertyData::insertedAt));
            if (oldest.isEmpty()) {
                return;
            }
            if (store.remove(oldest.get().key(), oldest.get())) {
                log.info("CACHE_EVICT key={} insertedAt={}", oldest.get().key(), oldest.get().insertedAt());
            }
        }
    }
}
