package com.sentimentfusion.common.model;

/**
 * Which branch of the agreement decision procedure produced a verdict.
 * The signal generator switches over this exhaustively.
 */
public enum Resolution {

    /** Neither model produced a valid opinion. */
    NO_VALID_MODELS,
    /** Exactly one model is valid; the other is ignored. */
    SINGLE_VALID_MODEL,
    /** Both valid and pointing the same way (including both neutral). */
    SAME_DIRECTION,
    /** Both valid, exactly one of them neutral. */
    NEUTRAL_VS_DIRECTIONAL,
    /** Opposite directions, one model strictly more confident. */
    DECISIVE_WINNER,
    /** Opposite directions with numerically equal confidence. */
    CONFIDENCE_TIE
}
