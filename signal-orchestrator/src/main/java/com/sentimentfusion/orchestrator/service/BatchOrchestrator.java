package com.sentimentfusion.orchestrator.service;

import com.sentimentfusion.common.model.BatchResult;
import com.sentimentfusion.common.model.BatchStatistics;
import com.sentimentfusion.common.model.ExecutionMetadata;
import com.sentimentfusion.common.model.SymbolAnalysisResult;
import com.sentimentfusion.common.trace.TraceContextUtil;
import com.sentimentfusion.orchestrator.config.FusionProperties;
import com.sentimentfusion.orchestrator.guard.SymbolFailureGuard;
import com.sentimentfusion.orchestrator.logger.PipelineFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs the per-symbol pipeline over a list of symbols.
 *
 * <p>Symbols are split into groups of {@code batchSize}. Symbols inside a group run
 * concurrently; groups run one after another with {@code interBatchDelay} between them.
 * Results come back in request order, one per requested symbol, duplicates included.
 *
 * <p>A symbol whose pipeline errors, returns nothing or is blank yields a degraded result and
 * never aborts the batch. The returned {@code Mono} does not error.
 */
@Service
public class BatchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final SymbolAnalyzer analyzer;
    private final PipelineFlowLogger flowLogger;
    private final FusionProperties properties;
    private final Clock clock;

    public BatchOrchestrator(SymbolAnalyzer analyzer,
                             PipelineFlowLogger flowLogger,
                             FusionProperties properties,
                             Clock clock) {
        this.analyzer   = analyzer;
        this.flowLogger = flowLogger;
        this.properties = properties;
        this.clock      = clock;
    }

    /** Runs with the configured batch size and inter-batch delay. */
    public Mono<BatchResult> runBatch(List<String> symbols) {
        return runBatch(symbols, BatchOptions.from(properties));
    }

    public Mono<BatchResult> runBatch(List<String> symbols, BatchOptions options) {
        List<String> requested = symbols == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(symbols));
        String traceId = TraceContextUtil.newTraceId();

        Mono<BatchResult> pipeline = Mono.defer(() -> {
            long startNanos = System.nanoTime();
            flowLogger.logBatchStarted(requested.size(), options.batchSize(), options.interBatchDelay(), traceId);

            return Flux.range(0, requested.size())
                .buffer(options.batchSize())
                .index()
                .concatMap(group -> runGroup(group.getT1(), group.getT2(), requested, options, traceId))
                .collectList()
                .map(results -> toBatchResult(requested.size(), results, elapsedMs(startNanos)))
                .doOnNext(batch -> flowLogger.logBatchResult(batch, traceId));
        });
        return TraceContextUtil.withTraceId(pipeline, traceId);
    }

    /** Single-symbol entry point with the same failure isolation as a batch member. */
    public Mono<SymbolAnalysisResult> analyzeOne(String symbol) {
        return TraceContextUtil.withTraceId(analyzeIsolated(symbol), TraceContextUtil.newTraceId());
    }

    private Flux<SymbolAnalysisResult> runGroup(long groupIndex, List<Integer> positions,
                                                List<String> requested, BatchOptions options,
                                                String traceId) {
        Mono<Long> pause = groupIndex == 0 ? Mono.empty() : Mono.delay(options.interBatchDelay());
        return pause.thenMany(Flux.defer(() -> {
            flowLogger.logGroupStarted(groupIndex + 1, positions.size(), traceId);
            return Flux.fromIterable(positions)
                .flatMapSequential(position -> analyzeIsolated(requested.get(position)));
        }));
    }

    private Mono<SymbolAnalysisResult> analyzeIsolated(String symbol) {
        return Mono.defer(() -> {
            Instant started = clock.instant();
            long startNanos = System.nanoTime();
            return Mono.defer(() -> symbol == null || symbol.isBlank()
                    ? Mono.<SymbolAnalysisResult>error(new IllegalArgumentException("Symbol must not be blank"))
                    : analyzer.analyzeOne(symbol))
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("No result produced for " + symbol)))
                .onErrorResume(e -> Mono.deferContextual(ctx -> {
                    String traceId = TraceContextUtil.getTraceId(ctx);
                    TraceContextUtil.withMdc(traceId, () ->
                        log.error("Symbol pipeline failed: symbol={} traceId={}", symbol, traceId, e)
                    );
                    SymbolAnalysisResult degraded =
                        SymbolFailureGuard.degrade(symbol, e, started, elapsedMs(startNanos));
                    flowLogger.logSymbolResult(degraded, traceId);
                    return Mono.just(degraded);
                }));
        });
    }

    private static BatchResult toBatchResult(int totalSymbols, List<SymbolAnalysisResult> results,
                                             long totalExecutionTimeMs) {
        BatchStatistics statistics = BatchStatistics.empty(totalSymbols);
        for (SymbolAnalysisResult result : results) {
            statistics = statistics.record(result);
        }
        ExecutionMetadata metadata = ExecutionMetadata.of(statistics, results.size(), totalExecutionTimeMs);
        return new BatchResult(List.copyOf(results), statistics, metadata);
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
