package com.sentimentfusion.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregated view over every provider failure of a single fetch attempt.
 * Only attached to a result when the fetch as a whole produced no usable articles.
 *
 * <p>Map keys are {@link NewsProvider#displayName()} and {@link ErrorSeverity#label()} so the
 * stored JSON reads the same way the provider and severity values do.
 */
public record ErrorSummary(
    @JsonProperty("totalErrors")      int totalErrors,
    @JsonProperty("errorsByProvider") Map<String, Integer> errorsByProvider,
    @JsonProperty("errorsBySeverity") Map<String, Integer> errorsBySeverity,
    @JsonProperty("retryableErrors")  int retryableErrors,
    @JsonProperty("permanentErrors")  int permanentErrors,
    @JsonProperty("errors")           List<ProviderError> errors,
    @JsonProperty("timestamp")        Instant timestamp
) {
    public int countFor(NewsProvider provider) {
        return errorsByProvider.getOrDefault(provider.displayName(), 0);
    }

    public int countFor(ErrorSeverity severity) {
        return errorsBySeverity.getOrDefault(severity.label(), 0);
    }
}
