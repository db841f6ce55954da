package com.sentimentfusion.common.consensus;

/**
 * Strength bands per resolution path.
 *
 * <ul>
 *   <li>{@code agreement}: both models valid and pointing the same way</li>
 *   <li>{@code decisiveWinner}: opposite directions resolved by strictly higher confidence</li>
 * </ul>
 * Both paths band the average of the two confidences.
 */
public record SignalBanding(StrengthBands agreement, StrengthBands decisiveWinner) {

    public static final SignalBanding DEFAULT = new SignalBanding(
        new StrengthBands(0.70, 0.60),
        new StrengthBands(0.80, 0.60));
}
