package com.sentimentfusion.orchestrator.persistence;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Flat per-symbol prediction row handed to the storage collaborator.
 *
 * <p>{@code newsFetchErrors} is the JSON-serialised {@code ErrorSummary}, present only when
 * content acquisition fully failed. {@code payload} is the whole result as JSON.
 */
@Data
@NoArgsConstructor
public class PredictionRecord {

    private String symbol;

    /** UTC calendar date of the analysis. */
    private LocalDate predictionDate;

    private Instant analyzedAt;

    private String direction;

    private String action;

    private String strength;

    private String agreementType;

    private Boolean modelsAgree;

    // Per-model columns; null when the model produced no opinion.

    private String modelADirection;
    private Double modelAConfidence;
    private String modelBDirection;
    private Double modelBConfidence;

    private String newsFetchErrors;

    private Long executionTimeMs;

    private String payload;
}
