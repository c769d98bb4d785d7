package com.momentumshift.scoring.logger;

import com.momentumshift.common.trace.RunContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Logs each stage a moment or batch passes through. Pure side effects; never
 * changes pipeline behaviour.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #MOMENT_BUILT}: raw event normalised into a Moment</li>
 *   <li>{@link #CONTEXT_ENRICHED}: participant histories resolved</li>
 *   <li>{@link #SCORE_COMPOSED}: MSS results emitted for the moment</li>
 *   <li>{@link #PREDICTION_ISSUED}: trajectory forecast attached to a result</li>
 *   <li>{@link #BATCH_EVALUATED}: calibration report produced</li>
 *   <li>{@link #WEIGHTS_REFIT}: new weight and model versions registered</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (reads runId from the Reactor Context):
 * <pre>
 *     .doOnEach(stageLogger.stage(PipelineStageLogger.MOMENT_BUILT))
 * </pre>
 */
@Component
public class PipelineStageLogger {

    private static final Logger log = LoggerFactory.getLogger(PipelineStageLogger.class);

    public static final String MOMENT_BUILT      = "MOMENT_BUILT";
    public static final String CONTEXT_ENRICHED  = "CONTEXT_ENRICHED";
    public static final String SCORE_COMPOSED    = "SCORE_COMPOSED";
    public static final String PREDICTION_ISSUED = "PREDICTION_ISSUED";
    public static final String BATCH_EVALUATED   = "BATCH_EVALUATED";
    public static final String WEIGHTS_REFIT     = "WEIGHTS_REFIT";

    /**
     * Returns a {@code doOnEach} consumer that logs {@code stageName} on every
     * {@code onNext}. The runId comes from the signal's context, never from MDC.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String runId = RunContextUtil.getRunId(signal.getContextView());
            RunContextUtil.withMdc(runId, () ->
                log.info("[Pipeline] stage={} runId={}", stageName, runId)
            );
        };
    }

    /** Same as {@link #stage(String)} with a subject such as a moment id or version label. */
    public <T> Consumer<Signal<T>> stage(String stageName, Function<T, String> subject) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String runId = RunContextUtil.getRunId(signal.getContextView());
            String about = subject.apply(signal.get());
            RunContextUtil.withMdc(runId, () ->
                log.info("[Pipeline] stage={} subject={} runId={}", stageName, about, runId)
            );
        };
    }

    public void logWithRunId(String stageName, String subject, String runId) {
        RunContextUtil.withMdc(runId, () ->
            log.info("[Pipeline] stage={} subject={} runId={}", stageName, subject, runId)
        );
    }
}
