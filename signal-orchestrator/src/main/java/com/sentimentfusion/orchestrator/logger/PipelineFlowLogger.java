package com.sentimentfusion.orchestrator.logger;

import com.sentimentfusion.common.model.BatchResult;
import com.sentimentfusion.common.model.SymbolAnalysisResult;
import com.sentimentfusion.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.time.Duration;
import java.util.Locale;
import java.util.function.Consumer;

/**
 * Stage logging for the per-symbol pipeline and the batch run. Side effects only.
 *
 * <p>Per-symbol stages, in order:
 * <ol>
 *   <li>{@link #SYMBOL_STARTED}</li>
 *   <li>{@link #CONTENT_FETCHED}</li>
 *   <li>{@link #MODELS_COMPLETED} (after any {@link #MODEL_RETRY_SCHEDULED})</li>
 *   <li>{@link #SIGNAL_GENERATED}</li>
 * </ol>
 * A symbol whose pipeline threw logs {@link #SYMBOL_DEGRADED} instead.
 *
 * <p>Batch stages: {@link #BATCH_STARTED}, one {@link #BATCH_GROUP_STARTED} per group, then
 * {@link #BATCH_COMPLETED}.
 *
 * <p>With {@code doOnEach} the traceId is read from the Reactor Context:
 * <pre>
 *     .doOnEach(flowLogger.stage(PipelineFlowLogger.CONTENT_FETCHED))
 * </pre>
 */
@Component
public class PipelineFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(PipelineFlowLogger.class);

    public static final String BATCH_STARTED         = "BATCH_STARTED";
    public static final String BATCH_GROUP_STARTED   = "BATCH_GROUP_STARTED";
    public static final String BATCH_COMPLETED       = "BATCH_COMPLETED";
    public static final String SYMBOL_STARTED        = "SYMBOL_STARTED";
    public static final String CONTENT_FETCHED       = "CONTENT_FETCHED";
    public static final String MODELS_COMPLETED      = "MODELS_COMPLETED";
    public static final String MODEL_RETRY_SCHEDULED = "MODEL_RETRY_SCHEDULED";
    public static final String SIGNAL_GENERATED      = "SIGNAL_GENERATED";
    public static final String SYMBOL_DEGRADED       = "SYMBOL_DEGRADED";

    /**
     * Returns a {@code doOnEach} consumer that logs {@code stageName} on {@code onNext} only.
     * Errors and completion are ignored.
     *
     * @param stageName one of the stage constants of this class
     * @param <T>       upstream element type, not logged
     * @return a consumer for {@code .doOnEach(...)} that reads the traceId from the signal's context
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[PipelineFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    /**
     * Logs a stage of one symbol's pipeline where the traceId is already at hand.
     *
     * @param stageName one of the stage constants of this class
     * @param symbol    the symbol being analyzed
     * @param traceId   id of the run, bridged to MDC for the call
     */
    public void logSymbolStage(String stageName, String symbol, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[PipelineFlow] stage={} symbol={} traceId={}", stageName, symbol, traceId)
        );
    }

    /**
     * Logs the finished symbol: the signal verdict, or the error at WARN for a degraded result.
     *
     * @param result  the assembled or degraded result
     * @param traceId id of the run
     */
    public void logSymbolResult(SymbolAnalysisResult result, String traceId) {
        TraceContextUtil.withMdc(traceId, () -> {
            if (result.isDegraded()) {
                log.warn("[PipelineFlow] stage={} symbol={} error=\"{}\" executionTimeMs={} traceId={}",
                    SYMBOL_DEGRADED, result.symbol(), result.error(), result.executionTimeMs(), traceId);
                return;
            }
            log.info("[PipelineFlow] stage={} symbol={} agreement={} direction={} strength={} action={} "
                     + "fetchFailed={} executionTimeMs={} traceId={}",
                SIGNAL_GENERATED, result.symbol(), result.comparison().type(),
                result.signal().direction(), result.signal().strength(), result.signal().action(),
                result.errorSummary() != null, result.executionTimeMs(), traceId);
        });
    }

    /**
     * @param symbolCount     number of requested symbols, duplicates and blanks included
     * @param batchSize       symbols per concurrent group
     * @param interBatchDelay pause between consecutive groups
     * @param traceId         id of the run
     */
    public void logBatchStarted(int symbolCount, int batchSize, Duration interBatchDelay, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[PipelineFlow] stage={} symbols={} batchSize={} interBatchDelayMs={} traceId={}",
                BATCH_STARTED, symbolCount, batchSize, interBatchDelay.toMillis(), traceId)
        );
    }

    /**
     * @param groupNumber 1-based position of the group in the run
     * @param groupSize   symbols in this group
     * @param traceId     id of the run
     */
    public void logGroupStarted(long groupNumber, int groupSize, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[PipelineFlow] stage={} group={} size={} traceId={}",
                BATCH_GROUP_STARTED, groupNumber, groupSize, traceId)
        );
    }

    /**
     * Logs the bucket counts and rates of a finished run.
     *
     * @param batch   the completed batch
     * @param traceId id of the run
     */
    public void logBatchResult(BatchResult batch, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[PipelineFlow] stage={} symbols={} fullAgreement={} partialAgreement={} "
                     + "disagreement={} errors={} agreementRate={} totalExecutionTimeMs={} traceId={}",
                BATCH_COMPLETED,
                batch.statistics().totalSymbols(),
                batch.statistics().fullAgreement(),
                batch.statistics().partialAgreement(),
                batch.statistics().disagreement(),
                batch.statistics().errors(),
                String.format(Locale.ROOT, "%.2f", batch.executionMetadata().agreementRate()),
                batch.executionMetadata().totalExecutionTimeMs(),
                traceId)
        );
    }
}
