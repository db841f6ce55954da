package com.sentimentfusion.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries a per-run trace id through Reactor pipelines.
 *
 * <p>The Reactor Context holds the id; MDC is written only for the duration of a single
 * log statement via {@link #withMdc}.
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    /**
     * @return a fresh random trace id, one per batch run or direct single-symbol call
     */
    public static String newTraceId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Stores {@code traceId} in the Reactor Context of {@code mono}.
     *
     * <p>{@code contextWrite} propagates upstream during subscription, so call this at the end
     * of pipeline assembly.
     *
     * @param mono    the pipeline to enrich
     * @param traceId the id every upstream operator will see
     * @param <T>     pipeline element type
     * @return the same pipeline with the id in its context
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /**
     * @param ctx context view from {@code Mono.deferContextual} or {@code Signal.getContextView()}
     * @return the trace id, or {@link #UNKNOWN} when none was written; never {@code null}
     */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    /**
     * Runs {@code logAction} with {@code traceId} in MDC and removes it afterwards, even when
     * the action throws.
     *
     * @param traceId   the id to expose to the log pattern
     * @param logAction the log statement(s) to run
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
