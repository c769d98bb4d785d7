package com.momentumshift.common.context;

import com.momentumshift.common.TestFixtures;
import com.momentumshift.common.model.CareerStage;
import com.momentumshift.common.model.PlayerContext;
import com.momentumshift.common.model.PlayerRole;
import com.momentumshift.common.model.Side;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StagedContextMultiplierTest {

    private final StagedContextMultiplier multiplier = new StagedContextMultiplier(TestFixtures.multiplierSettings());

    private static PlayerContext context(CareerStage stage, double baseline, double careerAverage) {
        return new PlayerContext("m-1", "p-1", PlayerRole.BATTER, stage, 3.0, baseline, careerAverage,
            10, Side.BENEFICIARY, 0.2, false);
    }

    @Test
    @DisplayName("earlier career stages are amplified more")
    void stageOrdering() {
        double rookie  = multiplier.multiplier(context(CareerStage.ROOKIE, 0.3, 0.3));
        double prime   = multiplier.multiplier(context(CareerStage.PRIME, 0.3, 0.3));
        double veteran = multiplier.multiplier(context(CareerStage.VETERAN, 0.3, 0.3));

        assertEquals(1.5, rookie, 1e-12);
        assertEquals(1.2, prime, 1e-12);
        assertEquals(1.0, veteran, 1e-12);
    }

    @Test
    @DisplayName("baseline below career average adds a form boost")
    void belowAverageBoost() {
        // deficit = (0.300 − 0.150) / 0.300 = 0.5 → form = 1 + 0.5 × 0.5 = 1.25
        assertEquals(1.2 * 1.25, multiplier.multiplier(context(CareerStage.PRIME, 0.150, 0.300)), 1e-12);
    }

    @Test
    @DisplayName("form boost is capped")
    void boostCapped() {
        // deficit = 3.0 → slope × deficit = 1.5, capped at 0.5
        assertEquals(1.2 * 1.5, multiplier.multiplier(context(CareerStage.PRIME, -0.600, 0.300)), 1e-12);
    }

    @Test
    @DisplayName("running hot earns no boost")
    void aboveAverageNoBoost() {
        assertEquals(0.0, StagedContextMultiplier.formDeficit(context(CareerStage.PRIME, 0.400, 0.300)));
    }

    @Test
    @DisplayName("zero career average yields no deficit")
    void zeroCareerAverage() {
        assertEquals(0.0, StagedContextMultiplier.formDeficit(context(CareerStage.ROOKIE, -1.0, 0.0)));
    }
}
