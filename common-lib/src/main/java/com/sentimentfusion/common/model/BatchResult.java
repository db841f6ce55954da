package com.sentimentfusion.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of a batch run: one result per requested symbol, in request order.
 */
public record BatchResult(
    @JsonProperty("results")           List<SymbolAnalysisResult> results,
    @JsonProperty("statistics")        BatchStatistics statistics,
    @JsonProperty("executionMetadata") ExecutionMetadata executionMetadata
) {}
