package com.sentimentfusion.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One failed provider attempt. Created once per failure and never mutated.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProviderError(
    @JsonProperty("provider")   NewsProvider provider,
    @JsonProperty("code")       String code,
    @JsonProperty("message")    String message,
    @JsonProperty("severity")   ErrorSeverity severity,
    @JsonProperty("retryable")  boolean retryable,
    @JsonProperty("httpStatus") Integer httpStatus,
    @JsonProperty("retryCount") Integer retryCount,
    @JsonProperty("timestamp")  Instant timestamp
) {}
