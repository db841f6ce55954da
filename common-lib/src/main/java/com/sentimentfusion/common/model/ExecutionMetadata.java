package com.sentimentfusion.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ExecutionMetadata(
    @JsonProperty("totalExecutionTimeMs") long totalExecutionTimeMs,
    @JsonProperty("symbolsProcessed")     int symbolsProcessed,
    @JsonProperty("agreementRate")        double agreementRate,
    @JsonProperty("successRate")          double successRate
) {
    public static ExecutionMetadata of(BatchStatistics stats, int symbolsProcessed, long totalExecutionTimeMs) {
        int total = stats.totalSymbols();
        double agreementRate = total > 0 ? (double) stats.fullAgreement() / total : 0.0;
        double successRate   = total > 0 ? (double) (total - stats.errors()) / total : 0.0;
        return new ExecutionMetadata(totalExecutionTimeMs, symbolsProcessed, agreementRate, successRate);
    }
}
