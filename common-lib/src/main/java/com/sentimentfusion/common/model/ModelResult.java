package com.sentimentfusion.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Output of one sentiment model adapter for one symbol.
 *
 * <p>{@code confidence == null} and/or a non-null {@code error} means the model produced no
 * opinion for this input. Such a result is excluded from direction and strength computation
 * entirely; it never counts as a neutral vote.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModelResult(
    @JsonProperty("role")             ModelRole role,
    @JsonProperty("model")            String model,
    @JsonProperty("direction")        Direction direction,
    @JsonProperty("confidence")       Double confidence,
    @JsonProperty("reasoning")        String reasoning,
    @JsonProperty("error")            String error,
    @JsonProperty("responseTimeMs")   Long responseTimeMs,
    @JsonProperty("articlesAnalyzed") Integer articlesAnalyzed,
    @JsonProperty("articleTitles")    List<String> articleTitles,
    @JsonProperty("analysisType")     String analysisType
) {
    public static final String NO_DATA = "No data";

    public ModelResult {
        if (direction == null) {
            direction = Direction.NEUTRAL;
        }
    }

    /** A successful classification. */
    public static ModelResult of(ModelRole role, String model, Direction direction,
                                 double confidence, String reasoning) {
        return new ModelResult(role, model, direction, confidence, reasoning,
            null, null, null, null, null);
    }

    /** Remote or transport failure: neutral, no confidence, error message set. */
    public static ModelResult failed(ModelRole role, String model, String error, String reasoning) {
        return new ModelResult(role, model, Direction.NEUTRAL, null, reasoning,
            error, null, null, null, null);
    }

    /** Short-circuit result for an empty article set; the remote model is never called. */
    public static ModelResult noData(ModelRole role, String model) {
        return new ModelResult(role, model, Direction.NEUTRAL, 0.0, "No news data available",
            NO_DATA, null, null, null, null);
    }

    /** Valid means a usable opinion: non-null, finite confidence and no error. */
    @JsonIgnore
    public boolean isValid() {
        return confidence != null && !confidence.isNaN() && error == null;
    }

    /** {@code true} when the failure came from the remote call rather than from missing input. */
    @JsonIgnore
    public boolean isRemoteFailure() {
        return !isValid() && !NO_DATA.equals(error);
    }

    public ModelResult withTiming(long responseTimeMs, List<String> articleTitles, String analysisType) {
        return new ModelResult(role, model, direction, confidence, reasoning, error,
            responseTimeMs, articleTitles.size(), List.copyOf(articleTitles), analysisType);
    }
}
