package com.momentumshift.common.moment;

import com.momentumshift.common.exception.MalformedMomentException;
import com.momentumshift.common.exception.MalformedMomentException.FieldViolation;
import com.momentumshift.common.exception.MalformedMomentException.Kind;
import com.momentumshift.common.model.HalfInning;
import com.momentumshift.common.model.Moment;
import com.momentumshift.common.model.OutcomeType;
import com.momentumshift.common.model.RawMomentEvent;
import com.momentumshift.common.model.RawPlay;
import com.momentumshift.common.model.SeasonPhase;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Normalises a {@link RawMomentEvent} into a canonical {@link Moment}.
 *
 * <p>Validation runs in three passes and stops after the first pass that finds
 * anything, so inconsistency checks never run on half-parsed input:
 * <ol>
 *   <li><b>missing-field</b>: required identifiers, scores, phase, outcome and
 *       the win-probability pair are present; participant ids are non-blank</li>
 *   <li><b>out-of-range</b>: win probabilities finite and in [0, 1], ΔWP in [-1, 1],
 *       inning ≥ 1, scores ≥ 0, enum values recognised</li>
 *   <li><b>inconsistent-state</b>: post-state equals pre-state plus the event's own effect:
 *       <pre>
 *   fielding team score unchanged
 *   batting team score never decreases
 *   batting runs ≥ outcome.minBattingRuns        (e.g. home run ≥ 1)
 *   Σ plays[].runsScored = batting runs          (when every play reports runs)
 *   WALK_OFF:   bottom half, inning ≥ 9, home team not ahead before, ahead after
 *   BLOWN_SAVE: fielding team led before, no longer leads after
 *   batter ≠ pitcher
 *       </pre></li>
 * </ol>
 *
 * <p>Pure transform with no I/O and no state.
 */
public final class MomentRecordBuilder {

    static final int REGULATION_INNINGS = 9;

    private MomentRecordBuilder() {}

    public static Moment build(RawMomentEvent raw) {
        if (raw == null) {
            throw new MalformedMomentException("unknown",
                List.of(new FieldViolation("event", Kind.MISSING_FIELD, "event payload is null")));
        }
        String momentId = raw.momentId() == null ? "unknown" : raw.momentId();

        List<FieldViolation> missing = checkMissing(raw);
        if (!missing.isEmpty()) {
            throw new MalformedMomentException(momentId, missing);
        }

        HalfInning half       = parseHalf(raw.halfInning());
        SeasonPhase phase     = parsePhase(raw.seasonPhase());
        OutcomeType outcome   = OutcomeType.parse(raw.outcomeType());

        List<FieldViolation> outOfRange = checkRanges(raw, half, phase, outcome);
        if (!outOfRange.isEmpty()) {
            throw new MalformedMomentException(momentId, outOfRange);
        }

        Moment moment = new Moment(
            raw.momentId(),
            raw.gameId(),
            raw.occurredAt(),
            raw.inning(),
            half,
            raw.homeScoreBefore(),
            raw.awayScoreBefore(),
            raw.homeScoreAfter(),
            raw.awayScoreAfter(),
            phase,
            raw.batterId().trim(),
            raw.pitcherId().trim(),
            raw.fielderIds() == null ? List.of() : raw.fielderIds().stream().map(String::trim).toList(),
            outcome,
            raw.homeWinProbabilityBefore(),
            raw.homeWinProbabilityAfter(),
            raw.plays() == null ? 0 : raw.plays().size());

        List<FieldViolation> inconsistent = checkConsistency(moment, raw.plays());
        if (!inconsistent.isEmpty()) {
            throw new MalformedMomentException(momentId, inconsistent);
        }
        return moment;
    }

    // ── pass 1: missing fields ──────────────────────────────────────────────

    private static List<FieldViolation> checkMissing(RawMomentEvent raw) {
        List<FieldViolation> v = new ArrayList<>();
        requireText(v, "momentId",    raw.momentId());
        requireText(v, "gameId",      raw.gameId());
        requireValue(v, "occurredAt", raw.occurredAt());
        requireValue(v, "inning",     raw.inning());
        requireText(v, "halfInning",  raw.halfInning());
        requireValue(v, "homeScoreBefore", raw.homeScoreBefore());
        requireValue(v, "awayScoreBefore", raw.awayScoreBefore());
        requireValue(v, "homeScoreAfter",  raw.homeScoreAfter());
        requireValue(v, "awayScoreAfter",  raw.awayScoreAfter());
        requireText(v, "seasonPhase", raw.seasonPhase());
        requireText(v, "batterId",    raw.batterId());
        requireText(v, "pitcherId",   raw.pitcherId());
        requireText(v, "outcomeType", raw.outcomeType());
        requireValue(v, "homeWinProbabilityBefore", raw.homeWinProbabilityBefore());
        requireValue(v, "homeWinProbabilityAfter",  raw.homeWinProbabilityAfter());
        if (raw.fielderIds() != null) {
            for (int i = 0; i < raw.fielderIds().size(); i++) {
                requireText(v, "fielderIds[" + i + "]", raw.fielderIds().get(i));
            }
        }
        return v;
    }

    private static void requireText(List<FieldViolation> v, String field, String value) {
        if (value == null || value.isBlank()) {
            v.add(new FieldViolation(field, Kind.MISSING_FIELD, "required and must not be blank"));
        }
    }

    private static void requireValue(List<FieldViolation> v, String field, Object value) {
        if (value == null) {
            v.add(new FieldViolation(field, Kind.MISSING_FIELD, "required"));
        }
    }

    // ── pass 2: ranges ──────────────────────────────────────────────────────

    private static List<FieldViolation> checkRanges(RawMomentEvent raw, HalfInning half,
                                                    SeasonPhase phase, OutcomeType outcome) {
        List<FieldViolation> v = new ArrayList<>();
        double before = raw.homeWinProbabilityBefore();
        double after  = raw.homeWinProbabilityAfter();
        probability(v, "homeWinProbabilityBefore", before);
        probability(v, "homeWinProbabilityAfter", after);
        if (Double.isFinite(before) && Double.isFinite(after)) {
            double delta = after - before;
            if (delta < -1.0 || delta > 1.0) {
                v.add(new FieldViolation("homeWinProbabilityAfter", Kind.OUT_OF_RANGE,
                    "win-probability delta " + delta + " outside [-1, 1]"));
            }
        }
        if (raw.inning() < 1) {
            v.add(new FieldViolation("inning", Kind.OUT_OF_RANGE, "must be >= 1 but was " + raw.inning()));
        }
        nonNegative(v, "homeScoreBefore", raw.homeScoreBefore());
        nonNegative(v, "awayScoreBefore", raw.awayScoreBefore());
        nonNegative(v, "homeScoreAfter",  raw.homeScoreAfter());
        nonNegative(v, "awayScoreAfter",  raw.awayScoreAfter());
        if (half == null) {
            v.add(new FieldViolation("halfInning", Kind.OUT_OF_RANGE, "unrecognised value " + raw.halfInning()));
        }
        if (phase == null) {
            v.add(new FieldViolation("seasonPhase", Kind.OUT_OF_RANGE, "unrecognised value " + raw.seasonPhase()));
        }
        if (outcome == null) {
            v.add(new FieldViolation("outcomeType", Kind.OUT_OF_RANGE, "unrecognised value " + raw.outcomeType()));
        }
        if (raw.plays() != null) {
            for (int i = 0; i < raw.plays().size(); i++) {
                RawPlay play = raw.plays().get(i);
                if (play != null && play.runsScored() != null && play.runsScored() < 0) {
                    v.add(new FieldViolation("plays[" + i + "].runsScored", Kind.OUT_OF_RANGE,
                        "must be >= 0 but was " + play.runsScored()));
                }
            }
        }
        return v;
    }

    private static void probability(List<FieldViolation> v, String field, double value) {
        if (!Double.isFinite(value) || value < 0.0 || value > 1.0) {
            v.add(new FieldViolation(field, Kind.OUT_OF_RANGE, "must be a finite value in [0, 1] but was " + value));
        }
    }

    private static void nonNegative(List<FieldViolation> v, String field, int value) {
        if (value < 0) {
            v.add(new FieldViolation(field, Kind.OUT_OF_RANGE, "must be >= 0 but was " + value));
        }
    }

    // ── pass 3: state consistency ───────────────────────────────────────────

    private static List<FieldViolation> checkConsistency(Moment m, List<RawPlay> plays) {
        List<FieldViolation> v = new ArrayList<>();
        String fieldingAfter = m.battingTeamIsHome() ? "awayScoreAfter" : "homeScoreAfter";
        String battingAfter  = m.battingTeamIsHome() ? "homeScoreAfter" : "awayScoreAfter";

        if (m.fieldingRunsScored() != 0) {
            v.add(new FieldViolation(fieldingAfter, Kind.INCONSISTENT_STATE,
                "fielding team score changed by " + m.fieldingRunsScored()));
        }
        int battingRuns = m.battingRunsScored();
        if (battingRuns < 0) {
            v.add(new FieldViolation(battingAfter, Kind.INCONSISTENT_STATE,
                "batting team score decreased by " + (-battingRuns)));
        } else if (battingRuns < m.outcomeType().minBattingRuns()) {
            v.add(new FieldViolation(battingAfter, Kind.INCONSISTENT_STATE,
                m.outcomeType() + " requires at least " + m.outcomeType().minBattingRuns()
                    + " run(s) but batting team scored " + battingRuns));
        }

        if (plays != null && !plays.isEmpty()
                && plays.stream().allMatch(p -> p != null && p.runsScored() != null)) {
            int playRuns = plays.stream().mapToInt(RawPlay::runsScored).sum();
            if (playRuns != battingRuns) {
                v.add(new FieldViolation("plays", Kind.INCONSISTENT_STATE,
                    "plays report " + playRuns + " run(s) but score changed by " + battingRuns));
            }
        }

        if (m.outcomeType() == OutcomeType.WALK_OFF) {
            if (m.halfInning() != HalfInning.BOTTOM || m.inning() < REGULATION_INNINGS) {
                v.add(new FieldViolation("halfInning", Kind.INCONSISTENT_STATE,
                    "walk-off requires bottom of inning " + REGULATION_INNINGS + " or later"));
            } else if (m.scoreDifferentialBefore() > 0 || m.scoreDifferentialAfter() <= 0) {
                v.add(new FieldViolation(battingAfter, Kind.INCONSISTENT_STATE,
                    "walk-off requires home team not ahead before and ahead after"));
            }
        }
        if (m.outcomeType() == OutcomeType.BLOWN_SAVE
                && (m.scoreDifferentialBefore() >= 0 || m.scoreDifferentialAfter() < 0)) {
            v.add(new FieldViolation(battingAfter, Kind.INCONSISTENT_STATE,
                "blown save requires the fielding team to lose its lead"));
        }
        if (m.batterId().equals(m.pitcherId())) {
            v.add(new FieldViolation("pitcherId", Kind.INCONSISTENT_STATE, "batter and pitcher are the same player"));
        }
        return v;
    }

    // ── enum parsing ────────────────────────────────────────────────────────

    static HalfInning parseHalf(String raw) {
        if (raw == null) return null;
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "TOP", "T"    -> HalfInning.TOP;
            case "BOTTOM", "BOT", "B" -> HalfInning.BOTTOM;
            default -> null;
        };
    }

    static SeasonPhase parsePhase(String raw) {
        if (raw == null) return null;
        return switch (raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_')) {
            case "REGULAR", "REGULAR_SEASON", "R" -> SeasonPhase.REGULAR_SEASON;
            case "POSTSEASON", "POST_SEASON", "PLAYOFFS", "P" -> SeasonPhase.POSTSEASON;
            default -> null;
        };
    }
}
