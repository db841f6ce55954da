package com.sentimentfusion.common.consensus;

import com.sentimentfusion.common.model.Agreement;
import com.sentimentfusion.common.model.AgreementDetails;
import com.sentimentfusion.common.model.Direction;
import com.sentimentfusion.common.model.ModelResult;
import com.sentimentfusion.common.model.Signal;
import com.sentimentfusion.common.model.SignalAction;
import com.sentimentfusion.common.model.SignalStrength;
import com.sentimentfusion.common.model.SignalType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps an {@link Agreement} plus both model results into an actionable {@link Signal}.
 *
 * <h3>Rules by resolution</h3>
 * <pre>
 *   NO_VALID_MODELS        → ERROR,  FAILED,   SKIP
 *   SAME_DIRECTION         → AGREEMENT, agreement bands on avg confidence, directional action
 *                            (neutral agreement → HOLD)
 *   DECISIVE_WINNER        → AGREEMENT, decisive-winner bands on avg confidence, winner's action
 *   SINGLE_VALID_MODEL     → PARTIAL_AGREEMENT, MODERATE, CONSIDER
 *   NEUTRAL_VS_DIRECTIONAL → PARTIAL_AGREEMENT, MODERATE, CONSIDER
 *   CONFIDENCE_TIE         → DISAGREEMENT, WEAK, HOLD
 * </pre>
 *
 * <p>Stateless and thread-safe; the bands are fixed at construction.
 */
public class SignalGenerator {

    private final SignalBanding banding;

    public SignalGenerator() {
        this(SignalBanding.DEFAULT);
    }

    public SignalGenerator(SignalBanding banding) {
        this.banding = banding;
    }

    public Signal generate(Agreement agreement, ModelResult a, ModelResult b) {
        AgreementDetails details = agreement.details();
        List<String> sources = sourceModels(a, b);

        return switch (details.resolution()) {
            case NO_VALID_MODELS -> Signal.failed(
                details.error() != null ? details.error() : "No news data available - analysis failed");

            case SAME_DIRECTION -> {
                double avg = average(a, b);
                SignalStrength strength = banding.agreement().classify(avg);
                Direction direction = agreement.direction();
                yield new Signal(SignalType.AGREEMENT, direction, strength,
                    String.format(Locale.ROOT,
                        "Both models agree on %s sentiment (avg confidence %.2f, spread %.2f)",
                        direction.label(), avg, details.confidenceSpread()),
                    SignalAction.directional(direction, strength), sources);
            }

            case DECISIVE_WINNER -> {
                double avg = average(a, b);
                SignalStrength strength = banding.decisiveWinner().classify(avg);
                Direction direction = agreement.direction();
                yield new Signal(SignalType.AGREEMENT, direction, strength,
                    String.format(Locale.ROOT,
                        "Higher-confidence winner (%s) on %s sentiment (%.2f vs %.2f, spread %.2f)",
                        details.winnerModel().key(), direction.label(),
                        details.winnerConfidence(), details.loserConfidence(), details.confidenceSpread()),
                    SignalAction.directional(direction, strength), sources);
            }

            case SINGLE_VALID_MODEL, NEUTRAL_VS_DIRECTIONAL -> {
                ModelResult leading = leadingModel(agreement, a, b);
                yield new Signal(SignalType.PARTIAL_AGREEMENT, agreement.direction(), SignalStrength.MODERATE,
                    String.format(Locale.ROOT, "Mixed signals: %s vs %s. Leading view (%s): %s",
                        label(details.modelADirection(), a), label(details.modelBDirection(), b),
                        leading.role().key(), leading.reasoning()),
                    SignalAction.CONSIDER, sources);
            }

            case CONFIDENCE_TIE -> new Signal(SignalType.DISAGREEMENT, agreement.direction(), SignalStrength.WEAK,
                String.format(Locale.ROOT,
                    "Models disagree with equal confidence (%.2f): model_a %s, model_b %s. No clear signal.",
                    details.modelAConfidence(), details.modelADirection().label(),
                    details.modelBDirection().label()),
                SignalAction.HOLD, sources);
        };
    }

    /** The valid model whose direction the partial agreement follows. */
    private static ModelResult leadingModel(Agreement agreement, ModelResult a, ModelResult b) {
        boolean aValid = a != null && a.isValid();
        boolean bValid = b != null && b.isValid();
        if (aValid && !bValid) return a;
        if (bValid && !aValid) return b;
        return a.direction() == agreement.direction() ? a : b;
    }

    private static double average(ModelResult a, ModelResult b) {
        return (a.confidence() + b.confidence()) / 2.0;
    }

    private static String label(Direction direction, ModelResult result) {
        if (result == null || !result.isValid()) return "unavailable";
        return direction.label();
    }

    private static List<String> sourceModels(ModelResult a, ModelResult b) {
        List<String> sources = new ArrayList<>(2);
        if (a != null && a.isValid()) sources.add(a.model());
        if (b != null && b.isValid()) sources.add(b.model());
        return List.copyOf(sources);
    }
}
