package com.momentumshift.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Un-validated event payload from the play-by-play / win-probability feed.
 * Every field is nullable; {@link com.momentumshift.common.moment.MomentRecordBuilder}
 * decides what is missing.
 *
 * <p>Win probabilities are from the home team's perspective.
 */
public record RawMomentEvent(
    @JsonProperty("momentId")                 String momentId,
    @JsonProperty("gameId")                   String gameId,
    @JsonProperty("occurredAt")               Instant occurredAt,
    @JsonProperty("inning")                   Integer inning,
    @JsonProperty("halfInning")               String halfInning,
    @JsonProperty("homeScoreBefore")          Integer homeScoreBefore,
    @JsonProperty("awayScoreBefore")          Integer awayScoreBefore,
    @JsonProperty("homeScoreAfter")           Integer homeScoreAfter,
    @JsonProperty("awayScoreAfter")           Integer awayScoreAfter,
    @JsonProperty("seasonPhase")              String seasonPhase,
    @JsonProperty("batterId")                 String batterId,
    @JsonProperty("pitcherId")                String pitcherId,
    @JsonProperty("fielderIds")               List<String> fielderIds,
    @JsonProperty("outcomeType")              String outcomeType,
    @JsonProperty("homeWinProbabilityBefore") Double homeWinProbabilityBefore,
    @JsonProperty("homeWinProbabilityAfter")  Double homeWinProbabilityAfter,
    @JsonProperty("plays")                    List<RawPlay> plays
) {}
