package com.sentimentfusion.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Final actionable output for a symbol: direction, strength and recommended action.
 */
public record Signal(
    @JsonProperty("type")          SignalType type,
    @JsonProperty("direction")     Direction direction,
    @JsonProperty("strength")      SignalStrength strength,
    @JsonProperty("reasoning")     String reasoning,
    @JsonProperty("action")        SignalAction action,
    @JsonProperty("sourceModels")  List<String> sourceModels
) {
    public static Signal failed(String reasoning) {
        return new Signal(SignalType.ERROR, Direction.NEUTRAL, SignalStrength.FAILED,
            reasoning, SignalAction.SKIP, List.of());
    }
}
