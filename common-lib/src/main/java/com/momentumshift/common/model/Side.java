package com.momentumshift.common.model;

/**
 * Which way the moment moved a participant's team win probability.
 * NEUTRAL only occurs when the win-probability delta is exactly zero.
 */
public enum Side {
    BENEFICIARY,
    ADVERSELY_AFFECTED,
    NEUTRAL;

    public static Side fromTeamDelta(double teamDelta) {
        if (teamDelta > 0.0) return BENEFICIARY;
        if (teamDelta < 0.0) return ADVERSELY_AFFECTED;
        return NEUTRAL;
    }
}
