package com.momentumshift.common.impact;

import com.momentumshift.common.model.SeasonPhase;
import com.momentumshift.common.settings.ImpactSettings;

/**
 * Statistical component of the MSS.
 *
 * <pre>
 *   S = ΔWP × phaseWeight(seasonPhase)
 * </pre>
 *
 * ΔWP is taken from the scored player's team perspective, so S is positive for
 * beneficiaries and negative for adversely affected players. No fitting happens
 * here; identical inputs always give identical output.
 */
public final class WinProbabilityImpactCalculator {

    private WinProbabilityImpactCalculator() {}

    public static double statisticalComponent(double teamDeltaWinProbability, SeasonPhase phase,
                                              ImpactSettings settings) {
        return teamDeltaWinProbability * settings.weightFor(phase);
    }
}
