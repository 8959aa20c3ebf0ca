package com.underwriting.propertydata.service;

import com.underwriting.common.exception.AllProvidersFailedException;
import com.underwriting.common.merge.MergeEngine;
import com.underwriting.common.model.CanonicalPropertyData;
import com.underwriting.common.model.NormalizedAddress;
import com.underwriting.common.model.ProvenanceEntry;
import com.underwriting.common.model.ProviderCapability;
import com.underwriting.common.model.ProviderErrorKind;
import com.underwriting.common.model.ProviderResult;
import com.underwriting.common.model.RankedProviderResult;
import com.underwriting.common.trace.AggregationContext;
import com.underwriting.propertydata.cache.PropertyDataCache;
import com.underwriting.propertydata.logger.AggregationFlowLogger;
import com.underwriting.propertydata.persistence.PropertyDataSink;
import com.underwriting.propertydata.provider.PropertyDataProvider;
import com.underwriting.propertydata.provider.ProviderErrors;
import com.underwriting.propertydata.registry.ProviderRegistry;
import com.underwriting.propertydata.registry.ProviderTier;
import com.underwriting.propertydata.registry.RegisteredProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Entry point of the engine: one address in, one canonical record out.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Validate the address (before any network call).</li>
 *   <li>Serve from {@link PropertyDataCache} when a live entry exists.</li>
 *   <li>Fan out to every candidate adapter at once, each call bounded by
 *       {@code min(adapter timeout, time left)}, the whole bounded by the global deadline.
 *       Calls still running at the deadline are cancelled and recorded as {@code TIMEOUT}.</li>
 *   <li>Fail with {@link AllProvidersFailedException} when nothing succeeded.</li>
 *   <li>Merge, cache, hand to the {@link PropertyDataSink}, return.</li>
 * </ol>
 *
 * <p>Cache and sink failures are logged and never fail the request. The trace id and the
 * deadline travel in the Reactor Context (see {@link AggregationContext}).
 */
@Service
public class PropertyAggregationService {

    private static final Logger log = LoggerFactory.getLogger(PropertyAggregationService.class);

    private final ProviderRegistry registry;
    private final MergeEngine mergeEngine;
    private final PropertyDataCache cache;
    private final PropertyDataSink sink;
    private final AggregationFlowLogger flowLogger;
    private final Clock clock;
    private final Duration deadline;

    @Autowired
    public PropertyAggregationService(ProviderRegistry registry,
                                      MergeEngine mergeEngine,
                                      PropertyDataCache cache,
                                      PropertyDataSink sink,
                                      AggregationFlowLogger flowLogger,
                                      Clock clock,
                                      @Value("${aggregation.deadline-seconds:15}") long deadlineSeconds) {
        this(registry, mergeEngine, cache, sink, flowLogger, clock, Duration.ofSeconds(deadlineSeconds));
    }

    public PropertyAggregationService(ProviderRegistry registry,
                                      MergeEngine mergeEngine,
                                      PropertyDataCache cache,
                                      PropertyDataSink sink,
                                      AggregationFlowLogger flowLogger,
                                      Clock clock,
                                      Duration deadline) {
        if (deadline.isNegative() || deadline.isZero()) {
            throw new IllegalArgumentException("aggregation deadline must be positive, got " + deadline);
        }
        this.registry    = registry;
        this.mergeEngine = mergeEngine;
        this.cache       = cache;
        this.sink        = sink;
        this.flowLogger  = flowLogger;
        this.clock       = clock;
        this.deadline    = deadline;
    }

    /** Normalizes the raw components first; malformed input fails with {@code InvalidAddressException}. */
    public Mono<CanonicalPropertyData> aggregate(String line1, String city, String state, String zip,
                                                 AggregationOptions options) {
        return Mono.defer(() -> aggregate(NormalizedAddress.of(line1, city, state, zip), options));
    }

    public Mono<CanonicalPropertyData> aggregate(NormalizedAddress address, AggregationOptions options) {
        Objects.requireNonNull(address, "address");
        AggregationOptions effective = options != null ? options : AggregationOptions.defaults();

        return Mono.defer(() -> {
            String traceId = UUID.randomUUID().toString();
            flowLogger.logWithTraceId(AggregationFlowLogger.REQUEST_RECEIVED, traceId,
                "address=" + address.format());

            Optional<CanonicalPropertyData> cached = lookupCache(address);
            if (cached.isPresent()) {
                flowLogger.logWithTraceId(AggregationFlowLogger.CACHE_SERVED, traceId,
                    "sources=" + cached.get().sources());
                return Mono.just(cached.get());
            }

            Instant deadlineAt = clock.instant().plus(deadline);
            return AggregationContext.withRequest(fanOut(address, effective, traceId, deadlineAt),
                traceId, deadlineAt);
        });
    }

    // ── fan-out ─────────────────────────────────────────────────────────────

    private record Call(RegisteredProvider registered, ProviderCapability scope) {
        String key() {
            return registered.providerId() + "/" + scope;
        }
    }

    private Mono<CanonicalPropertyData> fanOut(NormalizedAddress address, AggregationOptions options,
                                               String traceId, Instant deadlineAt) {
        List<Call> calls = selectCalls(options);
        if (calls.isEmpty()) {
            log.warn("No candidate providers for request. address={} options={} traceId={}",
                address.format(), options, traceId);
            return Mono.error(new AllProvidersFailedException(address, List.of()));
        }
        flowLogger.logWithTraceId(AggregationFlowLogger.FANOUT_STARTED, traceId,
            "calls=" + calls.stream().map(Call::key).toList());

        return Flux.fromIterable(calls)
            .flatMap(call -> invoke(call, address, deadlineAt), calls.size())
            .take(deadline)
            .collectList()
            .map(collected -> withCutOffCalls(calls, collected))
            .doOnEach(flowLogger.stage(AggregationFlowLogger.PROVIDERS_COLLECTED))
            .flatMap(results -> mergeAndStore(address, results, traceId));
    }

    private List<Call> selectCalls(AggregationOptions options) {
        List<Call> calls = new ArrayList<>();
        for (RegisteredProvider p : registry.propertyLevel()) {
            if (p.tier() == ProviderTier.COMPS && !options.includeComps()) {
                continue;
            }
            calls.add(new Call(p, ProviderCapability.PROPERTY_LEVEL));
        }
        if (options.includeAreaBenchmarks()) {
            for (RegisteredProvider p : registry.areaLevel()) {
                calls.add(new Call(p, ProviderCapability.AREA_LEVEL));
            }
        }
        return calls;
    }

    private Mono<RankedProviderResult> invoke(Call call, NormalizedAddress address, Instant deadlineAt) {
        RegisteredProvider registered = call.registered();
        PropertyDataProvider provider = registered.provider();

        return Mono.defer(() -> {
            Instant started = clock.instant();
            Duration left = Duration.between(started, deadlineAt);
            Duration budget = registered.timeout().compareTo(left) < 0 ? registered.timeout() : left;
            if (budget.isNegative() || budget.isZero()) {
                return Mono.just(failure(provider, started, ProviderErrorKind.TIMEOUT));
            }

            Mono<ProviderResult> fetch = call.scope() == ProviderCapability.AREA_LEVEL
                ? provider.fetchForArea(address)
                : provider.fetchForProperty(address);

            return fetch
                .timeout(budget, Mono.fromSupplier(() -> {
                    log.warn("Provider call timed out. provider={} scope={} budgetMs={}",
                        provider.providerId(), call.scope(), budget.toMillis());
                    return failure(provider, started, ProviderErrorKind.TIMEOUT);
                }))
                .switchIfEmpty(Mono.fromSupplier(() -> failure(provider, started, ProviderErrorKind.UNAVAILABLE)))
                .onErrorResume(e -> {
                    log.error("Provider signalled an error instead of a failed result. provider={} scope={}",
                        provider.providerId(), call.scope(), e);
                    return Mono.just(failure(provider, started, ProviderErrors.classify(e)));
                });
        })
        .map(result -> new RankedProviderResult(registered.rank(), call.scope(), result))
        .doOnNext(ranked -> {
            if (!ranked.result().isSuccess()) {
                log.warn("Provider failed. provider={} scope={} errorKind={}",
                    ranked.providerId(), call.scope(), ranked.result().error());
            }
        });
    }

    /** Calls that did not answer before the deadline become {@code TIMEOUT} failures. */
    private List<RankedProviderResult> withCutOffCalls(List<Call> calls, List<RankedProviderResult> collected) {
        Set<String> answered = new HashSet<>();
        for (RankedProviderResult r : collected) {
            answered.add(r.providerId() + "/" + r.scope());
        }
        List<RankedProviderResult> all = new ArrayList<>(collected);
        Instant now = clock.instant();
        for (Call call : calls) {
            if (answered.contains(call.key())) {
                continue;
            }
            log.warn("Provider cut off at aggregation deadline. provider={} scope={} errorKind={}",
                call.registered().providerId(), call.scope(), ProviderErrorKind.TIMEOUT);
            ProviderResult timedOut = ProviderResult.failure(
                call.registered().providerId(), now, deadline, ProviderErrorKind.TIMEOUT);
            all.add(new RankedProviderResult(call.registered().rank(), call.scope(), timedOut));
        }
        return all;
    }

    // ── merge and store ─────────────────────────────────────────────────────

    private Mono<CanonicalPropertyData> mergeAndStore(NormalizedAddress address,
                                                      List<RankedProviderResult> results,
                                                      String traceId) {
        boolean anySuccess = results.stream().anyMatch(r -> r.result().isSuccess());
        if (!anySuccess) {
            List<ProvenanceEntry> failures = results.stream()
                .sorted(RankedProviderResult.PRECEDENCE)
                .map(r -> ProvenanceEntry.failed(r.providerId(), r.result().metadata().fetchedAt(), r.result().error()))
                .toList();
            log.warn("All providers failed. address={} providers={} traceId={}",
                address.format(), failures.stream().map(ProvenanceEntry::providerId).toList(), traceId);
            return Mono.error(new AllProvidersFailedException(address, failures));
        }

        CanonicalPropertyData record = mergeEngine.merge(address, results);
        flowLogger.logRecord(record, traceId);
        storeInCache(address, record);

        return Mono.defer(() -> sink.save(record))
            .doOnSuccess(v -> flowLogger.logWithTraceId(AggregationFlowLogger.RECORD_PERSISTED, traceId,
                "address=" + address.format()))
            .onErrorResume(e -> {
                log.warn("Snapshot not persisted, returning record anyway. address={} traceId={} reason={}",
                    address.format(), traceId, e.getMessage());
                return Mono.empty();
            })
            .thenReturn(record);
    }

    // ── cache access (failures degrade to an uncached run) ─────────────────

    private Optional<CanonicalPropertyData> lookupCache(NormalizedAddress address) {
        try {
            return cache.get(address);
        } catch (RuntimeException e) {
            log.warn("Cache lookup failed, fetching uncached. address={} reason={}", address.format(), e.getMessage());
            return Optional.empty();
        }
    }

    private void storeInCache(NormalizedAddress address, CanonicalPropertyData record) {
        try {
            cache.put(address, record);
        } catch (RuntimeException e) {
            log.warn("Cache write failed, record served uncached. address={} reason={}", address.format(), e.getMessage());
        }
    }

    private ProviderResult failure(PropertyDataProvider provider, Instant started, ProviderErrorKind kind) {
        Instant now = clock.instant();
        return ProviderResult.failure(provider.providerId(), now, Duration.between(started, now), kind);
    }
}
