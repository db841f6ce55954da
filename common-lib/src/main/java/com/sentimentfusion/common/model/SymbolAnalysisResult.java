package com.sentimentfusion.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Per-symbol envelope returned by the pipeline and handed to the persistence collaborator.
 *
 * <p>{@code errorSummary} is non-null only when content acquisition fully failed.
 * {@code models} and {@code performanceMetrics} are {@code null} for degraded results, which
 * carry {@code error} instead.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SymbolAnalysisResult(
    @JsonProperty("symbol")             String symbol,
    @JsonProperty("timestamp")          Instant timestamp,
    @JsonProperty("models")             ModelPair models,
    @JsonProperty("comparison")         Agreement comparison,
    @JsonProperty("signal")             Signal signal,
    @JsonProperty("errorSummary")       ErrorSummary errorSummary,
    @JsonProperty("executionTimeMs")    long executionTimeMs,
    @JsonProperty("performanceMetrics") PerformanceMetrics performanceMetrics,
    @JsonProperty("error")              String error
) {
    /** Degraded result for a symbol whose pipeline threw. */
    public static SymbolAnalysisResult degraded(String symbol, Instant timestamp,
                                                String error, long executionTimeMs) {
        return new SymbolAnalysisResult(symbol, timestamp, null, Agreement.failed(error),
            Signal.failed("Analysis failed: " + error), null, executionTimeMs, null, error);
    }

    @JsonIgnore
    public boolean isDegraded() {
        return error != null;
    }
}
