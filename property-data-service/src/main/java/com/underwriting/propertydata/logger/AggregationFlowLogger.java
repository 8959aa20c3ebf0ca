package com.underwriting.propertydata.logger;

import com.underwriting.common.model.CanonicalPropertyData;
import com.underwriting.common.model.ProvenanceEntry;
import com.underwriting.common.trace.AggregationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Stage logging for one aggregation request. Pure side effects; never alters the pipeline.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}   address validated, trace id assigned</li>
 *   <li>{@link #CACHE_SERVED}       answered from cache, no provider called</li>
 *   <li>{@link #FANOUT_STARTED}     candidate providers selected</li>
 *   <li>{@link #PROVIDERS_COLLECTED} every call returned, failed or was cut off</li>
 *   <li>{@link #RECORD_MERGED}      canonical record built</li>
 *   <li>{@link #RECORD_PERSISTED}   snapshot handed to the sink</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (trace id read from the Reactor Context):
 * <pre>
 *     .doOnEach(flowLogger.stage(AggregationFlowLogger.RECORD_MERGED))
 * </pre>
 */
@Component
public class AggregationFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(AggregationFlowLogger.class);

    public static final String REQUEST_RECEIVED    = "REQUEST_RECEIVED";
    public static final String CACHE_SERVED        = "CACHE_SERVED";
    public static final String FANOUT_STARTED      = "FANOUT_STARTED";
    public static final String PROVIDERS_COLLECTED = "PROVIDERS_COLLECTED";
    public static final String RECORD_MERGED       = "RECORD_MERGED";
    public static final String RECORD_PERSISTED    = "RECORD_PERSISTED";

    /**
     * Returns a {@code doOnEach} consumer logging {@code stageName} on {@code onNext} only.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = AggregationContext.traceId(signal.getContextView());
            AggregationContext.withMdc(traceId, () ->
                log.info("[AggregationFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    /** Logs a stage with extra detail when the trace id is already at hand. */
    public void logWithTraceId(String stageName, String traceId, String detail) {
        AggregationContext.withMdc(traceId, () ->
            log.info("[AggregationFlow] stage={} {} traceId={}", stageName, detail, traceId)
        );
    }

    /** Compact summary of a finished record: sources, failures, partial flag. */
    public void logRecord(CanonicalPropertyData record, String traceId) {
        AggregationContext.withMdc(traceId, () ->
            log.info("[AggregationFlow] stage={} address={} sources={} failed={} partial={} traceId={}",
                     RECORD_MERGED,
                     record.address().format(), record.sources(),
                     record.failedProviders().stream().map(ProvenanceEntry::providerId).toList(),
                     record.isPartial(), traceId)
        );
    }
}
