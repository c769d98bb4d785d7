package com.momentumshift.common.composer;

import com.momentumshift.common.context.ContextMultiplierFunction;
import com.momentumshift.common.impact.WinProbabilityImpactCalculator;
import com.momentumshift.common.model.ComposerWeights;
import com.momentumshift.common.model.Moment;
import com.momentumshift.common.model.MssResult;
import com.momentumshift.common.model.PlayerContext;
import com.momentumshift.common.model.ResultFlag;
import com.momentumshift.common.model.ScoreBreakdown;
import com.momentumshift.common.model.SentimentSignal;
import com.momentumshift.common.settings.ImpactSettings;

import java.util.ArrayList;
import java.util.List;

/**
 * Combines the statistical and narrative components into the composite MSS.
 *
 * <pre>
 *   raw = w1·S + w2·N·contextMultiplier
 *   MSS = clamp(raw, -100, 100)
 * </pre>
 *
 * <p>Every sub-term is computed before the result is built, and the result is
 * created once. {@link ScoreBreakdown#reconstruct()} re-adds the stored terms
 * and equals the unclamped score exactly.
 *
 * <p>Stateless and deterministic: same inputs and weight version, same result.
 */
public final class ScoreComposer {

    public static final double MIN_SCORE = -100.0;
    public static final double MAX_SCORE =  100.0;

    private ScoreComposer() {}

    public static MssResult compose(Moment moment, PlayerContext context, SentimentSignal sentiment,
                                    ComposerWeights weights, ImpactSettings impact,
                                    ContextMultiplierFunction multiplierFunction) {
        double phaseWeight = impact.weightFor(moment.seasonPhase());
        double s = WinProbabilityImpactCalculator.statisticalComponent(
            context.teamDeltaWinProbability(), moment.seasonPhase(), impact);
        double n = sentiment == null ? 0.0 : sentiment.narrative();
        double multiplier = multiplierFunction.multiplier(context);

        ScoreBreakdown breakdown = breakdown(context.teamDeltaWinProbability(), phaseWeight, s, n, multiplier, weights);

        List<ResultFlag> flags = new ArrayList<>();
        if (sentiment == null || sentiment.noSentimentData()) flags.add(ResultFlag.NO_SENTIMENT_DATA);
        if (context.lowConfidence())                           flags.add(ResultFlag.LOW_CONFIDENCE_CONTEXT);
        if (breakdown.clamped())                               flags.add(ResultFlag.CLAMPED);

        return new MssResult(
            moment.momentId(),
            context.playerId(),
            context.role(),
            context.side(),
            weights.version(),
            s,
            n,
            multiplier,
            context.baseline(),
            clamp(breakdown.unclampedScore()),
            breakdown,
            flags);
    }

    /** Weighted sub-terms for already-computed components. */
    public static ScoreBreakdown breakdown(double teamDelta, double phaseWeight, double s, double n,
                                           double multiplier, ComposerWeights weights) {
        double statisticalTerm = weights.w1() * s;
        double narrativeTerm   = weights.w2() * n * multiplier;
        double unclamped       = statisticalTerm + narrativeTerm;
        return new ScoreBreakdown(teamDelta, phaseWeight, s, n, multiplier,
            weights.w1(), weights.w2(), statisticalTerm, narrativeTerm, unclamped,
            unclamped < MIN_SCORE || unclamped > MAX_SCORE);
    }

    static double clamp(double raw) {
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, raw));
    }
}
