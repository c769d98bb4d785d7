package com.momentumshift.common.settings;

/**
 * Context-enrichment configuration. There is no default trailing
 * window: callers must state one.
 *
 * <ul>
 *   <li>{@code trailingWindow} – N, appearances averaged into the baseline</li>
 *   <li>{@code minPriorAppearances} – fewer than this raises InsufficientHistoryException</li>
 *   <li>{@code rookieMaxSeasons} – below this many full seasons a player is a rookie</li>
 *   <li>{@code veteranMinSeasons} – above this many full seasons a player is a veteran</li>
 *   <li>{@code plateAppearancesPerSeason} / {@code inningsPerSeason} – one full season of volume</li>
 * </ul>
 */
public record ContextSettings(
    int trailingWindow,
    int minPriorAppearances,
    double rookieMaxSeasons,
    double veteranMinSeasons,
    int plateAppearancesPerSeason,
    double inningsPerSeason
) {
    public ContextSettings {
        if (trailingWindow < 1) {
            throw new IllegalArgumentException("trailingWindow must be >= 1 but was " + trailingWindow);
        }
        if (minPriorAppearances < 1 || minPriorAppearances > trailingWindow) {
            throw new IllegalArgumentException("minPriorAppearances must be in [1, trailingWindow] but was "
                + minPriorAppearances);
        }
        if (rookieMaxSeasons < 0 || veteranMinSeasons < rookieMaxSeasons) {
            throw new IllegalArgumentException("career-stage thresholds must satisfy 0 <= rookie <= veteran");
        }
        if (plateAppearancesPerSeason <= 0 || inningsPerSeason <= 0) {
            throw new IllegalArgumentException("per-season volumes must be positive");
        }
    }
}
