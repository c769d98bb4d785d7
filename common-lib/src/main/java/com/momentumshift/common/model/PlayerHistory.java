package com.momentumshift.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Snapshot returned by the player-history store for one player, restricted to
 * appearances strictly before the moment.
 *
 * <ul>
 *   <li>{@code careerPlateAppearances} / {@code careerInningsPitched} – volume used to
 *       discretise the career stage.</li>
 *   <li>{@code careerAverage} – long-run per-appearance performance value, the
 *       reference the trailing baseline is compared against.</li>
 *   <li>{@code recentPerformance} – per-appearance performance values, most recent first.
 *       Null entries in the payload are dropped.</li>
 * </ul>
 */
public record PlayerHistory(
    @JsonProperty("playerId")               String playerId,
    @JsonProperty("careerPlateAppearances") int careerPlateAppearances,
    @JsonProperty("careerInningsPitched")   double careerInningsPitched,
    @JsonProperty("careerAverage")          double careerAverage,
    @JsonProperty("recentPerformance")      List<Double> recentPerformance
) {
    public PlayerHistory {
        recentPerformance = recentPerformance == null
            ? List.of()
            : recentPerformance.stream().filter(Objects::nonNull).toList();
    }

    public static PlayerHistory empty(String playerId) {
        return new PlayerHistory(playerId, 0, 0.0, 0.0, List.of());
    }
}
