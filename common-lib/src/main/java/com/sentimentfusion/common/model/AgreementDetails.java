package com.sentimentfusion.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Audit detail attached to an {@link Agreement}: raw directions, confidences, spread and tie flags.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgreementDetails(
    @JsonProperty("resolution")         Resolution resolution,
    @JsonProperty("model_a_direction")  Direction modelADirection,
    @JsonProperty("model_b_direction")  Direction modelBDirection,
    @JsonProperty("model_a_confidence") Double modelAConfidence,
    @JsonProperty("model_b_confidence") Double modelBConfidence,
    @JsonProperty("confidence_spread")  Double confidenceSpread,
    @JsonProperty("winner_model")       ModelRole winnerModel,
    @JsonProperty("winner_confidence")  Double winnerConfidence,
    @JsonProperty("loser_confidence")   Double loserConfidence,
    @JsonProperty("is_tie")             boolean isTie,
    @JsonProperty("is_perfect_tie")     boolean isPerfectTie,
    @JsonProperty("error")              String error
) {}
