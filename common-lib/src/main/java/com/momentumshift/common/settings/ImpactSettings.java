package com.momentumshift.common.settings;

import com.momentumshift.common.model.SeasonPhase;

/** Phase weights for the statistical component. Postseason must weigh strictly more. */
public record ImpactSettings(double regularSeasonWeight, double postseasonWeight) {

    public ImpactSettings {
        if (!(regularSeasonWeight > 0.0)) {
            throw new IllegalArgumentException("regularSeasonWeight must be positive but was " + regularSeasonWeight);
        }
        if (!(postseasonWeight > regularSeasonWeight)) {
            throw new IllegalArgumentException("postseasonWeight (" + postseasonWeight
                + ") must be strictly greater than regularSeasonWeight (" + regularSeasonWeight + ")");
        }
    }

    public double weightFor(SeasonPhase phase) {
        return phase == SeasonPhase.POSTSEASON ? postseasonWeight : regularSeasonWeight;
    }
}
