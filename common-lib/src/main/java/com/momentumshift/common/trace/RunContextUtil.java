package com.momentumshift.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the analysis-batch run identifier through reactive pipelines.
 *
 * <p>The Reactor Context holds the runId. MDC is written only for the duration of a
 * single log statement via {@link #withMdc}.
 *
 * <pre>
 *     return RunContextUtil.withRunId(pipeline, runId);
 *     ...
 *     signal -> RunContextUtil.getRunId(signal.getContextView())
 * </pre>
 */
public final class RunContextUtil {

    public static final String RUN_ID_KEY = "runId";
    public static final String RUN_ID_HEADER = "X-Run-Id";
    public static final String UNKNOWN = "unknown";

    private RunContextUtil() {}

    /**
     * Stores {@code runId} in the Reactor Context. {@code contextWrite} propagates
     * upstream during subscription, so call this at the end of pipeline assembly.
     */
    public static <T> Mono<T> withRunId(Mono<T> mono, String runId) {
        return mono.contextWrite(ctx -> ctx.put(RUN_ID_KEY, runId));
    }

    public static <T> Flux<T> withRunId(Flux<T> flux, String runId) {
        return flux.contextWrite(ctx -> ctx.put(RUN_ID_KEY, runId));
    }

    /** Never {@code null}; {@value #UNKNOWN} when no runId was written. */
    public static String getRunId(ContextView ctx) {
        return ctx.getOrDefault(RUN_ID_KEY, UNKNOWN);
    }

    /** Reads the runId of the subscribing pipeline. */
    public static Mono<String> currentRunId() {
        return Mono.deferContextual(ctx -> Mono.just(getRunId(ctx)));
    }

    /**
     * Bridges {@code runId} into MDC while {@code logAction} runs, then removes it.
     * Only for logging side effects.
     */
    public static void withMdc(String runId, Runnable logAction) {
        MDC.put(RUN_ID_KEY, runId);
        try {
            logAction.run();
        } finally {
            MDC.remove(RUN_ID_KEY);
        }
    }
}
