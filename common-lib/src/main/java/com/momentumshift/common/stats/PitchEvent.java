package com.momentumshift.common.stats;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Set;

/**
 * One pitch-level tracking row. {@code event} is set only on the pitch that ends a
 * plate appearance and uses the tracking feed's names ({@code single}, {@code walk},
 * {@code grounded_into_double_play}, ...). {@code battedBallType} is set only when the
 * ball was put in play ({@code ground_ball}, {@code fly_ball}, {@code line_drive}, {@code popup}).
 */
public record PitchEvent(
    @JsonProperty("atBatNumber")    Integer atBatNumber,
    @JsonProperty("event")          String event,
    @JsonProperty("inning")         Integer inning,
    @JsonProperty("balls")          Integer balls,
    @JsonProperty("strikes")        Integer strikes,
    @JsonProperty("runnerOnFirst")  boolean runnerOnFirst,
    @JsonProperty("runnerOnSecond") boolean runnerOnSecond,
    @JsonProperty("runnerOnThird")  boolean runnerOnThird,
    @JsonProperty("runsScored")     Integer runsScored,
    @JsonProperty("launchSpeed")    Double launchSpeed,
    @JsonProperty("launchAngle")    Double launchAngle,
    @JsonProperty("hitDistance")    Double hitDistance,
    @JsonProperty("battedBallType") String battedBallType,
    @JsonProperty("wobaValue")      Double wobaValue,
    @JsonProperty("wobaDenom")      Double wobaDenom,
    @JsonProperty("releaseSpeed")   Double releaseSpeed
) {
    static final Set<String> HITS = Set.of("single", "double", "triple", "home_run");
    static final Set<String> NON_AT_BAT = Set.of("walk", "hit_by_pitch", "sac_fly", "sac_bunt");

    static final double HARD_HIT_SPEED    = 95.0;
    static final double BARREL_MIN_SPEED  = 98.0;
    static final double BARREL_MIN_ANGLE  = 8.0;
    static final double BARREL_MAX_ANGLE  = 32.0;

    public PitchEvent {
        event          = normalise(event);
        battedBallType = normalise(battedBallType);
    }

    private static String normalise(String value) {
        return value == null || value.isBlank() ? null : value.trim().toLowerCase(Locale.ROOT);
    }

    public boolean endsPlateAppearance() {
        return event != null;
    }

    public boolean isAtBat() {
        return event != null && !NON_AT_BAT.contains(event);
    }

    public boolean isHit() {
        return event != null && HITS.contains(event);
    }

    public boolean is(String name) {
        return name.equals(event);
    }

    public boolean runnerInScoringPosition() {
        return runnerOnSecond || runnerOnThird;
    }

    public boolean basesEmpty() {
        return !runnerOnFirst && !runnerOnSecond && !runnerOnThird;
    }

    public boolean countKnown() {
        return balls != null && strikes != null;
    }

    public boolean inPlay() {
        return battedBallType != null;
    }

    public boolean hardHit() {
        return launchSpeed != null && launchSpeed >= HARD_HIT_SPEED;
    }

    /** Exit velocity of at least 98 mph at a launch angle between 8 and 32 degrees. */
    public boolean barrel() {
        return launchSpeed != null && launchAngle != null
            && launchSpeed >= BARREL_MIN_SPEED
            && launchAngle >= BARREL_MIN_ANGLE && launchAngle <= BARREL_MAX_ANGLE;
    }
}
