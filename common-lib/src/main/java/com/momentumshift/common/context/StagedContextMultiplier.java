package com.momentumshift.common.context;

import com.momentumshift.common.model.PlayerContext;
import com.momentumshift.common.settings.MultiplierSettings;

/**
 * Default context multiplier: a career-stage factor scaled by a capped form boost.
 *
 * <pre>
 *   stageFactor = rookie | prime | veteran
 *   deficit     = max(0, (careerAverage − baseline) / |careerAverage|)   (0 when careerAverage = 0)
 *   formFactor  = 1 + min(formCap, formSlope × deficit)
 *   multiplier  = stageFactor × formFactor
 * </pre>
 *
 * A player at or above their career average receives no form boost.
 */
public final class StagedContextMultiplier implements ContextMultiplierFunction {

    private final MultiplierSettings settings;

    public StagedContextMultiplier(MultiplierSettings settings) {
        this.settings = settings;
    }

    @Override
    public double multiplier(PlayerContext context) {
        double stageFactor = switch (context.careerStage()) {
            case ROOKIE  -> settings.rookie();
            case PRIME   -> settings.prime();
            case VETERAN -> settings.veteran();
        };
        double formFactor = 1.0 + Math.min(settings.formCap(), settings.formSlope() * formDeficit(context));
        return stageFactor * formFactor;
    }

    static double formDeficit(PlayerContext context) {
        double reference = context.careerAverage();
        if (reference == 0.0) return 0.0;
        return Math.max(0.0, (reference - context.baseline()) / Math.abs(reference));
    }
}
