package com.sentimentfusion.common.consensus;

import com.sentimentfusion.common.model.Agreement;
import com.sentimentfusion.common.model.AgreementDetails;
import com.sentimentfusion.common.model.AgreementType;
import com.sentimentfusion.common.model.Direction;
import com.sentimentfusion.common.model.ModelResult;
import com.sentimentfusion.common.model.ModelRole;
import com.sentimentfusion.common.model.Resolution;

/**
 * Resolves two independent model opinions into one {@link Agreement}.
 *
 * <h3>Decision procedure (in order)</h3>
 * <ol>
 *   <li>Validity filter: valid = non-null confidence and no error. None valid → ERROR.</li>
 *   <li>Exactly one valid → PARTIAL_AGREEMENT in that model's direction; the other is ignored.</li>
 *   <li>Same direction (including both neutral) → FULL_AGREEMENT; equal confidences set
 *       {@code is_perfect_tie}.</li>
 *   <li>Exactly one neutral → PARTIAL_AGREEMENT in the non-neutral direction.</li>
 *   <li>Opposite directions:
 *     <ul>
 *       <li>equal confidence → DISAGREEMENT with {@code is_tie}; direction recorded as model A's
 *           for audit only</li>
 *       <li>otherwise the strictly more confident model wins → FULL_AGREEMENT on the winner's
 *           direction, {@code resolution=DECISIVE_WINNER}</li>
 *     </ul>
 *   </li>
 * </ol>
 *
 * <p>The winning direction of a decisive disagreement is always the one with strictly higher
 * confidence, never the opposite and never an average.
 *
 * <p>Stateless, pure and thread-safe.
 */
public class AgreementResolver {

    public Agreement resolve(ModelResult a, ModelResult b) {
        boolean aValid = a != null && a.isValid();
        boolean bValid = b != null && b.isValid();

        Direction aDir  = a != null ? a.direction() : null;
        Direction bDir  = b != null ? b.direction() : null;
        Double    aConf = aValid ? a.confidence() : null;
        Double    bConf = bValid ? b.confidence() : null;

        if (!aValid && !bValid) {
            return new Agreement(false, AgreementType.ERROR, null,
                details(Resolution.NO_VALID_MODELS, aDir, bDir, null, null, null,
                        null, null, null, false, false,
                        "No valid model output - both models failed to analyze"));
        }

        if (aValid != bValid) {
            ModelResult valid = aValid ? a : b;
            return new Agreement(false, AgreementType.PARTIAL_AGREEMENT, valid.direction(),
                details(Resolution.SINGLE_VALID_MODEL, aDir, bDir, aConf, bConf, null,
                        valid.role(), valid.confidence(), null, false, false, null));
        }

        double spread = Math.abs(aConf - bConf);
        boolean equalConfidence = Double.compare(aConf, bConf) == 0;

        if (aDir == bDir) {
            ModelRole leader = aConf >= bConf ? ModelRole.MODEL_A : ModelRole.MODEL_B;
            return new Agreement(true, AgreementType.FULL_AGREEMENT, aDir,
                details(Resolution.SAME_DIRECTION, aDir, bDir, aConf, bConf, spread,
                        leader, Math.max(aConf, bConf), Math.min(aConf, bConf),
                        false, equalConfidence, null));
        }

        if (!aDir.isDirectional() || !bDir.isDirectional()) {
            Direction dominant = aDir.isDirectional() ? aDir : bDir;
            return new Agreement(false, AgreementType.PARTIAL_AGREEMENT, dominant,
                details(Resolution.NEUTRAL_VS_DIRECTIONAL, aDir, bDir, aConf, bConf, spread,
                        null, null, null, false, false, null));
        }

        if (equalConfidence) {
            return new Agreement(false, AgreementType.DISAGREEMENT, aDir,
                details(Resolution.CONFIDENCE_TIE, aDir, bDir, aConf, bConf, spread,
                        null, null, null, true, false, null));
        }

        boolean aWins = aConf > bConf;
        ModelRole winner = aWins ? ModelRole.MODEL_A : ModelRole.MODEL_B;
        return new Agreement(true, AgreementType.FULL_AGREEMENT, aWins ? aDir : bDir,
            details(Resolution.DECISIVE_WINNER, aDir, bDir, aConf, bConf, spread,
                    winner, aWins ? aConf : bConf, aWins ? bConf : aConf, false, false, null));
    }

    private static AgreementDetails details(Resolution resolution, Direction aDir, Direction bDir,
                                            Double aConf, Double bConf, Double spread,
                                            ModelRole winner, Double winnerConf, Double loserConf,
                                            boolean isTie, boolean isPerfectTie, String error) {
        return new AgreementDetails(resolution, aDir, bDir, aConf, bConf, spread,
            winner, winnerConf, loserConf, isTie, isPerfectTie, error);
    }
}
