package com.sentimentfusion.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Verdict on how far two model opinions concur and which direction (if any) is trusted.
 * Pure function output; recomputed on every call. {@code direction} is {@code null} for
 * {@link AgreementType#ERROR}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Agreement(
    @JsonProperty("agree")     boolean agree,
    @JsonProperty("type")      AgreementType type,
    @JsonProperty("direction") Direction direction,
    @JsonProperty("details")   AgreementDetails details
) {
    /** Verdict used for a symbol whose pipeline failed before both opinions were available. */
    public static Agreement failed(String reason) {
        return new Agreement(false, AgreementType.ERROR, null,
            new AgreementDetails(Resolution.NO_VALID_MODELS, null, null, null, null, null,
                null, null, null, false, false, reason));
    }
}
