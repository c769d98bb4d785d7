package com.momentumshift.common.stats;

import com.momentumshift.common.model.PlayerRole;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compares a player's performance before and after a moment.
 *
 * <pre>
 *   c_i   = clamp(change_i / scale_i, -1, 1)      (sign flipped where lower is better)
 *   score = 50 + 50 · Σ w_i c_i / Σ w_i
 * </pre>
 *
 * <p>Batter scales: AVG .050, OBP .050, SLG .100, HR rate .030, K-rate reduction .050,
 * barrel rate .030, launch speed 2.0 mph, RISP AVG .070.
 * Pitcher scales: ERA reduction 1.0, WHIP reduction .300, K/9 1.5, BB/9 reduction 1.0,
 * HR/9 reduction 0.5, barrel-rate-allowed reduction .030, velocity 1.0 mph,
 * RISP AVG-against reduction .050. A side with nothing put in play has a barrel rate of 0.
 */
public final class RealizedShiftCalculator {

    public static final double NEUTRAL = 50.0;

    public static final String BATTING_AVERAGE = "battingAverage";
    public static final String ON_BASE         = "onBasePercentage";
    public static final String SLUGGING        = "sluggingPercentage";
    public static final String HOME_RUN_RATE   = "homeRunRate";
    public static final String STRIKEOUT_RATE  = "strikeoutRate";
    public static final String BARREL_RATE     = "barrelRate";
    public static final String LAUNCH_SPEED    = "launchSpeed";
    public static final String SITUATIONAL     = "situational";

    public static final String ERA              = "era";
    public static final String WHIP             = "whip";
    public static final String STRIKEOUTS_PER_9 = "strikeoutsPerNine";
    public static final String WALKS_PER_9      = "walksPerNine";
    public static final String HOME_RUNS_PER_9  = "homeRunsPerNine";
    public static final String VELOCITY         = "velocity";

    static final double PITCHER_RISP_DEFAULT = 0.300;

    public static final Map<String, Double> DEFAULT_BATTER_WEIGHTS = ordered(
        BATTING_AVERAGE, 0.15, ON_BASE, 0.15, SLUGGING, 0.15, HOME_RUN_RATE, 0.10,
        STRIKEOUT_RATE, 0.10, BARREL_RATE, 0.15, LAUNCH_SPEED, 0.10, SITUATIONAL, 0.10);

    public static final Map<String, Double> DEFAULT_PITCHER_WEIGHTS = ordered(
        ERA, 0.15, WHIP, 0.15, STRIKEOUTS_PER_9, 0.15, WALKS_PER_9, 0.10,
        HOME_RUNS_PER_9, 0.10, BARREL_RATE, 0.15, VELOCITY, 0.10, SITUATIONAL, 0.10);

    private RealizedShiftCalculator() {}

    public static RealizedShift forRole(String playerId, PlayerRole role,
                                        List<PitchEvent> before, List<PitchEvent> after,
                                        Map<String, Double> weights) {
        if (role == PlayerRole.PITCHER) {
            return pitcher(playerId, PitcherSummary.from(before), PitcherSummary.from(after), weights);
        }
        return batter(playerId, BatterSummary.from(before), BatterSummary.from(after), weights);
    }

    public static RealizedShift batter(String playerId, BatterSummary before, BatterSummary after,
                                       Map<String, Double> weights) {
        Map<String, Double> w = resolve(weights, DEFAULT_BATTER_WEIGHTS);
        if (!before.available() || !after.available()) {
            return unavailable(playerId, PlayerRole.BATTER, w);
        }
        Map<String, Double> c = new LinkedHashMap<>();
        c.put(BATTING_AVERAGE, normalise(after.battingAverage() - before.battingAverage(), 0.050));
        c.put(ON_BASE,         normalise(after.onBasePercentage() - before.onBasePercentage(), 0.050));
        c.put(SLUGGING,        normalise(after.sluggingPercentage() - before.sluggingPercentage(), 0.100));
        c.put(HOME_RUN_RATE,   normalise(after.homeRunRate() - before.homeRunRate(), 0.030));
        c.put(STRIKEOUT_RATE,  normalise(before.strikeoutRate() - after.strikeoutRate(), 0.050));
        c.put(BARREL_RATE,     normalise(after.battedBall().barrelRateOrZero()
                                       - before.battedBall().barrelRateOrZero(), 0.030));
        c.put(LAUNCH_SPEED,    normalise(after.averageLaunchSpeed() - before.averageLaunchSpeed(), 2.0));
        c.put(SITUATIONAL,     normalise(orDefault(after.rispAverage(), 0.0) - orDefault(before.rispAverage(), 0.0), 0.070));
        return new RealizedShift(playerId, PlayerRole.BATTER, true, score(c, w), c, w);
    }

    public static RealizedShift pitcher(String playerId, PitcherSummary before, PitcherSummary after,
                                        Map<String, Double> weights) {
        Map<String, Double> w = resolve(weights, DEFAULT_PITCHER_WEIGHTS);
        if (!before.available() || !after.available()) {
            return unavailable(playerId, PlayerRole.PITCHER, w);
        }
        Map<String, Double> c = new LinkedHashMap<>();
        c.put(ERA,              normalise(before.era() - after.era(), 1.0));
        c.put(WHIP,             normalise(before.whip() - after.whip(), 0.300));
        c.put(STRIKEOUTS_PER_9, normalise(after.strikeoutsPerNine() - before.strikeoutsPerNine(), 1.5));
        c.put(WALKS_PER_9,      normalise(before.walksPerNine() - after.walksPerNine(), 1.0));
        c.put(HOME_RUNS_PER_9,  normalise(before.homeRunsPerNine() - after.homeRunsPerNine(), 0.5));
        c.put(BARREL_RATE,      normalise(before.battedBallAllowed().barrelRateOrZero()
                                        - after.battedBallAllowed().barrelRateOrZero(), 0.030));
        c.put(VELOCITY,         normalise(after.averageVelocity() - before.averageVelocity(), 1.0));
        c.put(SITUATIONAL,      normalise(orDefault(before.rispAverageAgainst(), PITCHER_RISP_DEFAULT)
                                        - orDefault(after.rispAverageAgainst(), PITCHER_RISP_DEFAULT), 0.050));
        return new RealizedShift(playerId, PlayerRole.PITCHER, true, score(c, w), c, w);
    }

    static double normalise(double change, double scale) {
        return Math.max(-1.0, Math.min(1.0, change / scale));
    }

    private static double score(Map<String, Double> components, Map<String, Double> weights) {
        double total = 0.0;
        double weighted = 0.0;
        for (Map.Entry<String, Double> weight : weights.entrySet()) {
            total += weight.getValue();
            weighted += weight.getValue() * components.getOrDefault(weight.getKey(), 0.0);
        }
        return NEUTRAL + NEUTRAL * (weighted / total);
    }

    private static RealizedShift unavailable(String playerId, PlayerRole role, Map<String, Double> weights) {
        return new RealizedShift(playerId, role, false, NEUTRAL, Map.of(), weights);
    }

    private static Map<String, Double> resolve(Map<String, Double> requested, Map<String, Double> defaults) {
        if (requested == null || requested.isEmpty()) return defaults;
        double total = 0.0;
        for (Map.Entry<String, Double> e : requested.entrySet()) {
            if (!defaults.containsKey(e.getKey())) {
                throw new IllegalArgumentException("Unknown realized-shift component: " + e.getKey());
            }
            if (e.getValue() == null || e.getValue() < 0.0 || !Double.isFinite(e.getValue())) {
                throw new IllegalArgumentException("Weight for " + e.getKey() + " must be a finite value >= 0");
            }
            total += e.getValue();
        }
        if (total <= 0.0) {
            throw new IllegalArgumentException("Realized-shift weights must not all be zero");
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(requested));
    }

    private static double orDefault(Double value, double fallback) {
        return value == null ? fallback : value;
    }

    private static Map<String, Double> ordered(Object... keyValues) {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], (Double) keyValues[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
