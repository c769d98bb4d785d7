package com.momentumshift.common.context;

import com.momentumshift.common.model.CareerStage;
import com.momentumshift.common.model.PlayerHistory;
import com.momentumshift.common.model.PlayerRole;
import com.momentumshift.common.settings.ContextSettings;

/**
 * Discretises career volume into a {@link CareerStage}.
 *
 * <pre>
 *   seasons = careerInningsPitched / inningsPerSeason          (pitchers)
 *   seasons = careerPlateAppearances / plateAppearancesPerSeason (everyone else)
 *
 *   seasons &lt;  rookieMaxSeasons   → ROOKIE
 *   seasons &gt;  veteranMinSeasons  → VETERAN
 *   otherwise                     → PRIME
 * </pre>
 */
public final class CareerStageClassifier {

    private CareerStageClassifier() {}

    public static double seasonsPlayed(PlayerHistory history, PlayerRole role, ContextSettings settings) {
        if (history == null) return 0.0;
        return role == PlayerRole.PITCHER
            ? history.careerInningsPitched() / settings.inningsPerSeason()
            : (double) history.careerPlateAppearances() / settings.plateAppearancesPerSeason();
    }

    public static CareerStage classify(double seasonsPlayed, ContextSettings settings) {
        if (seasonsPlayed < settings.rookieMaxSeasons())  return CareerStage.ROOKIE;
        if (seasonsPlayed > settings.veteranMinSeasons()) return CareerStage.VETERAN;
        return CareerStage.PRIME;
    }
}
