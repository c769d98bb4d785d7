package com.momentumshift.common.stats;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pitching summary over a set of pitch rows.
 * <pre>
 *   outs = field outs + strikeouts + force outs + 2 × GIDP
 *   IP   = outs / 3, or batters faced / 3 when no out was recorded
 *   ERA  = max(0, 9 × runs / IP)     WHIP = (H + BB) / IP
 *   K/9, BB/9, HR/9 = 9 × count / IP  K/BB = K / BB, or K when BB = 0
 * </pre>
 * Runs allowed count scoring plays: a play that brings in any runs adds one, so a
 * three-run homer is one run. Without any run data they are estimated as H / 2.
 * Situational splits and the batted-ball profile describe what hitters did against him.
 */
public record PitcherSummary(
    @JsonProperty("battersFaced")        int battersFaced,
    @JsonProperty("pitches")             int pitches,
    @JsonProperty("inningsPitched")      double inningsPitched,
    @JsonProperty("hits")                int hits,
    @JsonProperty("walks")               int walks,
    @JsonProperty("strikeouts")          int strikeouts,
    @JsonProperty("homeRuns")            int homeRuns,
    @JsonProperty("runsAllowed")         double runsAllowed,
    @JsonProperty("era")                 double era,
    @JsonProperty("whip")                double whip,
    @JsonProperty("strikeoutsPerNine")   double strikeoutsPerNine,
    @JsonProperty("walksPerNine")        double walksPerNine,
    @JsonProperty("homeRunsPerNine")     double homeRunsPerNine,
    @JsonProperty("strikeoutWalkRatio")  double strikeoutWalkRatio,
    @JsonProperty("averageVelocity")     double averageVelocity,
    @JsonProperty("rispAverageAgainst")  Double rispAverageAgainst,
    @JsonProperty("battedBallAllowed")   BattedBallProfile battedBallAllowed,
    @JsonProperty("situational")         Map<String, SituationalSplit> situational
) {
    public PitcherSummary {
        battedBallAllowed = battedBallAllowed == null ? BattedBallProfile.NONE : battedBallAllowed;
        situational = situational == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(situational));
    }

    public boolean available() {
        return battersFaced > 0;
    }

    public static PitcherSummary from(List<PitchEvent> rows) {
        long distinctAtBats = rows.stream().map(PitchEvent::atBatNumber).filter(Objects::nonNull).distinct().count();
        int battersFaced = distinctAtBats > 0
            ? (int) distinctAtBats
            : (int) rows.stream().filter(PitchEvent::endsPlateAppearance).count();

        int hits = 0, bb = 0, so = 0, hr = 0, fieldOuts = 0, forceOuts = 0, gidp = 0;
        for (PitchEvent row : rows) {
            if (row.isHit()) hits++;
            if (!row.endsPlateAppearance()) continue;
            switch (row.event()) {
                case "walk"                      -> bb++;
                case "strikeout"                 -> so++;
                case "field_out"                 -> fieldOuts++;
                case "force_out"                 -> forceOuts++;
                case "grounded_into_double_play" -> gidp++;
                default -> { }
            }
            if (row.is("home_run")) hr++;
        }
        int outs = fieldOuts + so + forceOuts + 2 * gidp;
        double ip = outs > 0 ? outs / 3.0 : battersFaced / 3.0;

        boolean runData = rows.stream().anyMatch(r -> r.runsScored() != null);
        double runs = runData
            ? rows.stream().filter(r -> r.runsScored() != null && r.runsScored() > 0).count()
            : hits * 0.5;

        double era  = ip > 0 ? Math.max(0.0, 9.0 * runs / ip) : 0.0;
        double whip = ip > 0 ? (hits + bb) / ip : 0.0;
        double k9   = ip > 0 ? 9.0 * so / ip : 0.0;
        double bb9  = ip > 0 ? 9.0 * bb / ip : 0.0;
        double hr9  = ip > 0 ? 9.0 * hr / ip : 0.0;
        double kbb  = bb > 0 ? (double) so / bb : so;
        double velo = rows.stream()
            .filter(r -> r.releaseSpeed() != null)
            .mapToDouble(PitchEvent::releaseSpeed)
            .average().orElse(0.0);

        Map<String, SituationalSplit> situational = SituationalSplits.pitcher(rows);
        return new PitcherSummary(battersFaced, rows.size(), ip, hits, bb, so, hr, runs,
            era, whip, k9, bb9, hr9, kbb, velo, SituationalSplits.risp(situational),
            BattedBallProfile.from(rows), situational);
    }
}
