package com.momentumshift.common.stats;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Contact quality over balls put in play. Rates are shares of {@code battedBalls};
 * for a pitcher they describe contact allowed. Unavailable when nothing was put in play.
 */
public record BattedBallProfile(
    @JsonProperty("available")      boolean available,
    @JsonProperty("battedBalls")    int battedBalls,
    @JsonProperty("groundBallRate") double groundBallRate,
    @JsonProperty("flyBallRate")    double flyBallRate,
    @JsonProperty("lineDriveRate")  double lineDriveRate,
    @JsonProperty("popupRate")      double popupRate,
    @JsonProperty("hardHitRate")    double hardHitRate,
    @JsonProperty("barrelRate")     double barrelRate
) {
    static final BattedBallProfile NONE = new BattedBallProfile(false, 0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0);

    /** Barrel rate, or 0 when no ball was put in play. */
    public double barrelRateOrZero() {
        return available ? barrelRate : 0.0;
    }

    public static BattedBallProfile from(List<PitchEvent> rows) {
        int total = 0, ground = 0, fly = 0, line = 0, popup = 0, hard = 0, barrels = 0;
        for (PitchEvent row : rows) {
            if (!row.inPlay()) continue;
            total++;
            switch (row.battedBallType()) {
                case "ground_ball" -> ground++;
                case "fly_ball"    -> fly++;
                case "line_drive"  -> line++;
                case "popup"       -> popup++;
                default -> { }
            }
            if (row.hardHit()) hard++;
            if (row.barrel()) barrels++;
        }
        if (total == 0) return NONE;
        double n = total;
        return new BattedBallProfile(true, total, ground / n, fly / n, line / n, popup / n, hard / n, barrels / n);
    }
}
