package com.sentimentfusion.orchestrator.service;

import com.sentimentfusion.common.consensus.AgreementResolver;
import com.sentimentfusion.common.consensus.SignalGenerator;
import com.sentimentfusion.common.model.Agreement;
import com.sentimentfusion.common.model.Article;
import com.sentimentfusion.common.model.ModelPair;
import com.sentimentfusion.common.model.PerformanceMetrics;
import com.sentimentfusion.common.model.Signal;
import com.sentimentfusion.common.model.SymbolAnalysisResult;
import com.sentimentfusion.common.trace.TraceContextUtil;
import com.sentimentfusion.news.model.FetchOutcome;
import com.sentimentfusion.news.service.ContentFetchService;
import com.sentimentfusion.orchestrator.config.FusionProperties;
import com.sentimentfusion.orchestrator.logger.PipelineFlowLogger;
import com.sentimentfusion.sentiment.service.DualModelDispatchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Per-symbol pipeline.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Fetch articles through the provider fallback chain.</li>
 *   <li>Run both model adapters concurrently on the same articles.</li>
 *   <li>If both models failed remotely, re-run the model stage with a fixed back-off.</li>
 *   <li>Resolve agreement, generate the signal, assemble the result.</li>
 * </ol>
 *
 * <p>The error summary is attached only when the fetch produced zero articles. A fetch served
 * by a fallback provider is a success and carries none.
 */
@Service
public class SymbolAnalysisService implements SymbolAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SymbolAnalysisService.class);

    static final int MODELS_EXECUTED = 2;

    private final ContentFetchService contentFetchService;
    private final DualModelDispatchService dispatchService;
    private final AgreementResolver agreementResolver;
    private final SignalGenerator signalGenerator;
    private final PipelineFlowLogger flowLogger;
    private final Clock clock;
    private final int modelRetryAttempts;
    private final Duration modelRetryBackoff;

    public SymbolAnalysisService(ContentFetchService contentFetchService,
                                 DualModelDispatchService dispatchService,
                                 AgreementResolver agreementResolver,
                                 SignalGenerator signalGenerator,
                                 PipelineFlowLogger flowLogger,
                                 FusionProperties properties,
                                 Clock clock) {
        this.contentFetchService = contentFetchService;
        this.dispatchService     = dispatchService;
        this.agreementResolver   = agreementResolver;
        this.signalGenerator     = signalGenerator;
        this.flowLogger          = flowLogger;
        this.clock               = clock;
        this.modelRetryAttempts  = Math.max(0, properties.getModelRetryAttempts());
        this.modelRetryBackoff   = properties.modelRetryBackoff();
    }

    @Override
    public Mono<SymbolAnalysisResult> analyzeOne(String symbol) {
        return Mono.deferContextual(ctx -> {
            String traceId  = TraceContextUtil.getTraceId(ctx);
            Instant started = clock.instant();
            long startNanos = System.nanoTime();
            flowLogger.logSymbolStage(PipelineFlowLogger.SYMBOL_STARTED, symbol, traceId);

            return contentFetchService.fetch(symbol)
                .doOnEach(flowLogger.stage(PipelineFlowLogger.CONTENT_FETCHED))
                .flatMap(outcome -> dispatchWithRetry(symbol, outcome.articles(), traceId)
                    .doOnEach(flowLogger.stage(PipelineFlowLogger.MODELS_COMPLETED))
                    .map(pair -> assemble(symbol, started, outcome, pair, elapsedMs(startNanos))))
                .doOnNext(result -> flowLogger.logSymbolResult(result, traceId));
        }).contextWrite(ctx -> ctx.hasKey(TraceContextUtil.TRACE_ID_KEY)
            ? ctx
            : ctx.put(TraceContextUtil.TRACE_ID_KEY, TraceContextUtil.newTraceId()));
    }

    /**
     * Dispatches both models; when both fail remotely the stage is retried on the same articles.
     * Once retries are exhausted the last pair is kept as is.
     */
    private Mono<ModelPair> dispatchWithRetry(String symbol, List<Article> articles, String traceId) {
        return Mono.defer(() -> dispatchService.dispatch(symbol, articles))
            .flatMap(pair -> pair.bothFailedRemotely()
                ? Mono.<ModelPair>error(new BothModelsFailedException(pair))
                : Mono.just(pair))
            .retryWhen(Retry.fixedDelay(modelRetryAttempts, modelRetryBackoff)
                .filter(BothModelsFailedException.class::isInstance)
                .doBeforeRetry(retry -> {
                    ModelPair failed = ((BothModelsFailedException) retry.failure()).pair();
                    flowLogger.logSymbolStage(PipelineFlowLogger.MODEL_RETRY_SCHEDULED, symbol, traceId);
                    TraceContextUtil.withMdc(traceId, () ->
                        log.warn("Both models failed, retrying model stage: symbol={} attempt={}/{} "
                                 + "backoffMs={} modelA=\"{}\" modelB=\"{}\"",
                            symbol, retry.totalRetries() + 1, modelRetryAttempts,
                            modelRetryBackoff.toMillis(), failed.modelA().error(), failed.modelB().error())
                    );
                })
                .onRetryExhaustedThrow((retrySpec, retry) -> retry.failure()))
            .onErrorResume(BothModelsFailedException.class, e -> Mono.just(e.pair()));
    }

    private SymbolAnalysisResult assemble(String symbol, Instant timestamp, FetchOutcome outcome,
                                          ModelPair pair, long elapsedMs) {
        Agreement agreement = agreementResolver.resolve(pair.modelA(), pair.modelB());
        Signal signal       = signalGenerator.generate(agreement, pair.modelA(), pair.modelB());
        PerformanceMetrics metrics =
            new PerformanceMetrics(elapsedMs, MODELS_EXECUTED, pair.successfulModels());
        return new SymbolAnalysisResult(symbol, timestamp, pair, agreement, signal,
            outcome.errorSummaryIfFailed(), elapsedMs, metrics, null);
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }

    /** Carries the failed pair through {@code retryWhen}; never leaves this class. */
    private static final class BothModelsFailedException extends RuntimeException {

        private final transient ModelPair pair;

        BothModelsFailedException(ModelPair pair) {
            super("Both models failed: " + pair.modelA().error() + " / " + pair.modelB().error(),
                null, false, false);
            this.pair = pair;
        }

        ModelPair pair() {
            return pair;
        }
    }
}
