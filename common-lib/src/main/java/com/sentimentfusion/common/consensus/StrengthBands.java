package com.sentimentfusion.common.consensus;

import com.sentimentfusion.common.model.SignalStrength;

/**
 * Three-band mapping from a confidence value to a {@link SignalStrength}.
 *
 * <pre>
 *   confidence >= strong   → STRONG
 *   confidence >= moderate → MODERATE
 *   otherwise              → WEAK
 * </pre>
 */
public record StrengthBands(double strong, double moderate) {

    public StrengthBands {
        if (moderate < 0.0 || strong > 1.0 || moderate > strong) {
            throw new IllegalArgumentException(
                "Invalid strength bands: require 0 <= moderate <= strong <= 1, got moderate="
                    + moderate + " strong=" + strong);
        }
    }

    public SignalStrength classify(double confidence) {
        if (confidence >= strong)   return SignalStrength.STRONG;
        if (confidence >= moderate) return SignalStrength.MODERATE;
        return SignalStrength.WEAK;
    }
}
