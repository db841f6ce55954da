package com.sentimentfusion.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PerformanceMetrics(
    @JsonProperty("totalTimeMs")      long totalTimeMs,
    @JsonProperty("modelsExecuted")   int modelsExecuted,
    @JsonProperty("successfulModels") int successfulModels
) {}
