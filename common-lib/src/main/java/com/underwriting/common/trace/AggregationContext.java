package com.underwriting.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.time.Instant;
import java.util.Optional;

/**
 * Per-request values carried through a reactive aggregation in the Reactor Context:
 * the trace id used in every log line, and the absolute deadline of the fan-out.
 *
 * <p>Reactor Context is the source of truth for both. MDC is written only as a
 * temporary bridge around a single log statement, never as a ThreadLocal store.
 *
 * <p>The deadline lets code deep inside an adapter (retry loops in particular) decide
 * whether another attempt still fits, without the orchestrator passing it explicitly.
 */
public final class AggregationContext {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String DEADLINE_KEY = "aggregationDeadline";

    private AggregationContext() {}

    /**
     * Stores {@code traceId} and {@code deadline} in the Reactor Context of {@code mono}.
     * Call at the end of pipeline assembly: {@code contextWrite} propagates upstream.
     */
    public static <T> Mono<T> withRequest(Mono<T> mono, String traceId, Instant deadline) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId).put(DEADLINE_KEY, deadline));
    }

    /** Returns the trace id, or {@code "unknown"} if absent. Never {@code null}. */
    public static String traceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    public static Optional<Instant> deadline(ContextView ctx) {
        return ctx.getOrEmpty(DEADLINE_KEY);
    }

    /**
     * Bridges {@code traceId} into MDC for the duration of {@code logAction}, then removes it.
     */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
