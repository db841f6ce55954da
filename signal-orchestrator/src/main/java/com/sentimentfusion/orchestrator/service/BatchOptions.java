package com.sentimentfusion.orchestrator.service;

import com.sentimentfusion.orchestrator.config.FusionProperties;

import java.time.Duration;

/**
 * Per-run batching options. {@code batchSize} bounds how many symbols run concurrently;
 * {@code interBatchDelay} separates consecutive groups.
 */
public record BatchOptions(int batchSize, Duration interBatchDelay) {

    public BatchOptions {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, got " + batchSize);
        }
        if (interBatchDelay == null || interBatchDelay.isNegative()) {
            throw new IllegalArgumentException("interBatchDelay must be >= 0, got " + interBatchDelay);
        }
    }

    public static BatchOptions from(FusionProperties properties) {
        return new BatchOptions(properties.getBatchSize(), properties.interBatchDelay());
    }
}
