package com.momentumshift.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Canonical, validated game event. Immutable once built.
 *
 * <p>Win probabilities are stored from the home team's perspective;
 * {@link #deltaWinProbability()} is the authoritative ΔWP and always lies in [-1, 1].
 * Per-team deltas are derived with {@link #teamDelta(boolean)}.
 */
public record Moment(
    @JsonProperty("momentId")                 String momentId,
    @JsonProperty("gameId")                   String gameId,
    @JsonProperty("occurredAt")               Instant occurredAt,
    @JsonProperty("inning")                   int inning,
    @JsonProperty("halfInning")               HalfInning halfInning,
    @JsonProperty("homeScoreBefore")          int homeScoreBefore,
    @JsonProperty("awayScoreBefore")          int awayScoreBefore,
    @JsonProperty("homeScoreAfter")           int homeScoreAfter,
    @JsonProperty("awayScoreAfter")           int awayScoreAfter,
    @JsonProperty("seasonPhase")              SeasonPhase seasonPhase,
    @JsonProperty("batterId")                 String batterId,
    @JsonProperty("pitcherId")                String pitcherId,
    @JsonProperty("fielderIds")               List<String> fielderIds,
    @JsonProperty("outcomeType")              OutcomeType outcomeType,
    @JsonProperty("homeWinProbabilityBefore") double homeWinProbabilityBefore,
    @JsonProperty("homeWinProbabilityAfter")  double homeWinProbabilityAfter,
    @JsonProperty("pitchCount")               int pitchCount
) {
    public Moment {
        fielderIds = fielderIds == null ? List.of() : List.copyOf(fielderIds);
    }

    public double deltaWinProbability() {
        return homeWinProbabilityAfter - homeWinProbabilityBefore;
    }

    public boolean battingTeamIsHome() {
        return halfInning == HalfInning.BOTTOM;
    }

    /** ΔWP seen from one team: positive means the moment helped that team. */
    public double teamDelta(boolean homeTeam) {
        double delta = deltaWinProbability();
        return homeTeam ? delta : -delta;
    }

    /** Team perspective for a participant: batters bat, everyone else fields. */
    public boolean isHomeTeam(PlayerRole role) {
        return role == PlayerRole.BATTER ? battingTeamIsHome() : !battingTeamIsHome();
    }

    public int battingRunsScored() {
        return battingTeamIsHome()
            ? homeScoreAfter - homeScoreBefore
            : awayScoreAfter - awayScoreBefore;
    }

    public int fieldingRunsScored() {
        return battingTeamIsHome()
            ? awayScoreAfter - awayScoreBefore
            : homeScoreAfter - homeScoreBefore;
    }

    /** Batting team score minus fielding team score, before the event. */
    public int scoreDifferentialBefore() {
        return battingTeamIsHome()
            ? homeScoreBefore - awayScoreBefore
            : awayScoreBefore - homeScoreBefore;
    }

    public int scoreDifferentialAfter() {
        return battingTeamIsHome()
            ? homeScoreAfter - awayScoreAfter
            : awayScoreAfter - homeScoreAfter;
    }

    /**
     * Batter first, pitcher second, then credited fielders in feed order.
     * A player appearing twice keeps the first role listed.
     */
    public List<Participant> participants() {
        List<Participant> participants = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        if (seen.add(batterId))  participants.add(new Participant(batterId, PlayerRole.BATTER));
        if (seen.add(pitcherId)) participants.add(new Participant(pitcherId, PlayerRole.PITCHER));
        for (String fielder : fielderIds) {
            if (seen.add(fielder)) participants.add(new Participant(fielder, PlayerRole.FIELDER));
        }
        return participants;
    }
}
