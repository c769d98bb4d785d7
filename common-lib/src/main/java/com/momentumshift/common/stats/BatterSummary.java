package com.momentumshift.common.stats;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Offensive summary over a set of pitch rows.
 * <pre>
 *   AVG = H / AB      OBP = (H + BB + HBP) / PA      SLG = TB / AB      OPS = OBP + SLG
 *   wOBA = Σ wobaValue / Σ wobaDenom
 * </pre>
 * Ratios with a zero denominator are 0, as are tracking averages and maxima with no
 * data. {@code rispAverage} is {@code null} when no row had a runner in scoring position.
 */
public record BatterSummary(
    @JsonProperty("plateAppearances")   int plateAppearances,
    @JsonProperty("atBats")             int atBats,
    @JsonProperty("singles")            int singles,
    @JsonProperty("doubles")            int doubles,
    @JsonProperty("triples")            int triples,
    @JsonProperty("homeRuns")           int homeRuns,
    @JsonProperty("hits")               int hits,
    @JsonProperty("walks")              int walks,
    @JsonProperty("strikeouts")         int strikeouts,
    @JsonProperty("hitByPitch")         int hitByPitch,
    @JsonProperty("battingAverage")     double battingAverage,
    @JsonProperty("onBasePercentage")   double onBasePercentage,
    @JsonProperty("sluggingPercentage") double sluggingPercentage,
    @JsonProperty("ops")                double ops,
    @JsonProperty("woba")               double woba,
    @JsonProperty("averageLaunchSpeed") double averageLaunchSpeed,
    @JsonProperty("averageLaunchAngle") double averageLaunchAngle,
    @JsonProperty("maxExitVelocity")    double maxExitVelocity,
    @JsonProperty("maxDistance")        double maxDistance,
    @JsonProperty("rispAverage")        Double rispAverage,
    @JsonProperty("battedBall")         BattedBallProfile battedBall,
    @JsonProperty("situational")        Map<String, SituationalSplit> situational
) {
    public BatterSummary {
        battedBall  = battedBall == null ? BattedBallProfile.NONE : battedBall;
        situational = situational == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(situational));
    }

    public boolean available() {
        return plateAppearances > 0;
    }

    public double homeRunRate() {
        return (double) homeRuns / Math.max(atBats, 1);
    }

    public double strikeoutRate() {
        return (double) strikeouts / Math.max(plateAppearances, 1);
    }

    public static BatterSummary from(List<PitchEvent> rows) {
        int pa = 0, ab = 0, singles = 0, doubles = 0, triples = 0, hr = 0, bb = 0, so = 0, hbp = 0;
        double wobaValue = 0.0, wobaDenom = 0.0;
        for (PitchEvent row : rows) {
            if (row.wobaValue() != null) wobaValue += row.wobaValue();
            if (row.wobaDenom() != null) wobaDenom += row.wobaDenom();
            if (!row.endsPlateAppearance()) continue;
            pa++;
            if (row.isAtBat()) ab++;
            switch (row.event()) {
                case "single"       -> singles++;
                case "double"       -> doubles++;
                case "triple"       -> triples++;
                case "home_run"     -> hr++;
                case "walk"         -> bb++;
                case "strikeout"    -> so++;
                case "hit_by_pitch" -> hbp++;
                default -> { }
            }
        }
        int hits = singles + doubles + triples + hr;
        double avg = ab > 0 ? (double) hits / ab : 0.0;
        double obp = pa > 0 ? (double) (hits + bb + hbp) / pa : 0.0;
        double slg = ab > 0 ? (double) (singles + 2 * doubles + 3 * triples + 4 * hr) / ab : 0.0;
        double woba = wobaDenom > 0 ? wobaValue / wobaDenom : 0.0;

        List<Double> speeds = rows.stream().map(PitchEvent::launchSpeed).filter(Objects::nonNull).toList();
        List<Double> angles = rows.stream().map(PitchEvent::launchAngle).filter(Objects::nonNull).toList();
        List<Double> distances = rows.stream().map(PitchEvent::hitDistance).filter(Objects::nonNull).toList();

        Map<String, SituationalSplit> situational = SituationalSplits.batter(rows);
        return new BatterSummary(pa, ab, singles, doubles, triples, hr, hits, bb, so, hbp,
            avg, obp, slg, obp + slg, woba,
            mean(speeds), mean(angles), max(speeds), max(distances),
            SituationalSplits.risp(situational), BattedBallProfile.from(rows), situational);
    }

    static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    static double max(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
    }
}
