package com.momentumshift.common.model;

import java.util.Locale;

/**
 * Categorical result of a moment. {@code minBattingRuns} is the least number of
 * runs the batting team must score for the recorded outcome to be consistent
 * with the score change.
 */
public enum OutcomeType {
    SINGLE(0),
    DOUBLE(0),
    TRIPLE(0),
    HOME_RUN(1),
    WALK(0),
    HIT_BY_PITCH(0),
    STRIKEOUT(0),
    FIELD_OUT(0),
    DOUBLE_PLAY(0),
    SACRIFICE(0),
    ERROR(0),
    WALK_OFF(1),
    BLOWN_SAVE(1),
    DEFENSIVE_PLAY(0),
    OTHER(0);

    private final int minBattingRuns;

    OutcomeType(int minBattingRuns) {
        this.minBattingRuns = minBattingRuns;
    }

    public int minBattingRuns() {
        return minBattingRuns;
    }

    /**
     * Lenient parse accepting feed spellings such as {@code home_run},
     * {@code Home Run} or {@code walk-off}.
     *
     * @return the matching constant, or {@code null} when unrecognised
     */
    public static OutcomeType parse(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        try {
            return OutcomeType.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
