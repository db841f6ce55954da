package com.sentimentfusion.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Sentiment direction reported by a classifier and carried through to the final signal.
 *
 * <ul>
 *   <li>BULLISH: positive price impact expected</li>
 *   <li>BEARISH: negative price impact expected</li>
 *   <li>NEUTRAL: no directional view</li>
 * </ul>
 */
public enum Direction {

    BULLISH("bullish"),
    BEARISH("bearish"),
    NEUTRAL("neutral");

    private final String label;

    Direction(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** {@code true} for BULLISH and BEARISH. */
    public boolean isDirectional() {
        return this != NEUTRAL;
    }

    /**
     * Maps a free-form model label to a direction. {@code up}/{@code down} aliases are accepted;
     * anything unrecognised (including {@code null}) is NEUTRAL.
     */
    @JsonCreator
    public static Direction fromLabel(String label) {
        if (label == null) return NEUTRAL;
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "bullish", "up", "positive"   -> BULLISH;
            case "bearish", "down", "negative" -> BEARISH;
            default                            -> NEUTRAL;
        };
    }
}
