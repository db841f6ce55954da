package com.sentimentfusion.common.model;

/**
 * Recommended action carried by a {@link Signal}.
 * Directional actions come in three strengths per side; CONSIDER, HOLD, AVOID and SKIP are non-committal.
 */
public enum SignalAction {

    STRONG_BUY,
    BUY,
    WEAK_BUY,
    STRONG_SELL,
    SELL,
    WEAK_SELL,
    CONSIDER,
    HOLD,
    AVOID,
    SKIP;

    /**
     * Directional action for a strength band. Neutral direction maps to HOLD.
     */
    public static SignalAction directional(Direction direction, SignalStrength strength) {
        return switch (direction) {
            case BULLISH -> switch (strength) {
                case STRONG   -> STRONG_BUY;
                case MODERATE -> BUY;
                case WEAK     -> WEAK_BUY;
                case FAILED   -> SKIP;
            };
            case BEARISH -> switch (strength) {
                case STRONG   -> STRONG_SELL;
                case MODERATE -> SELL;
                case WEAK     -> WEAK_SELL;
                case FAILED   -> SKIP;
            };
            case NEUTRAL -> strength == SignalStrength.FAILED ? SKIP : HOLD;
        };
    }
}
