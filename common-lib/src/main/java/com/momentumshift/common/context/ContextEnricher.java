package com.momentumshift.common.context;

import com.momentumshift.common.exception.InsufficientHistoryException;
import com.momentumshift.common.model.CareerStage;
import com.momentumshift.common.model.Moment;
import com.momentumshift.common.model.Participant;
import com.momentumshift.common.model.PlayerContext;
import com.momentumshift.common.model.PlayerHistory;
import com.momentumshift.common.model.Side;
import com.momentumshift.common.settings.ContextSettings;

import java.util.List;

/**
 * Attaches career stage, trailing baseline and side to each participant of a moment.
 *
 * <p><b>Baseline</b>: mean of the most recent {@code min(trailingWindow, available)}
 * performance values. When fewer than {@code minPriorAppearances} values exist the
 * strict path throws {@link InsufficientHistoryException}; whether to retry through
 * {@link #enrichLowConfidence} or skip the player is decided by the caller's
 * configured policy, not here.
 *
 * <p><b>Side</b>: sign of ΔWP seen from the participant's team (batter → batting
 * team, pitcher and fielders → fielding team).
 */
public final class ContextEnricher {

    private ContextEnricher() {}

    public static PlayerContext enrich(Moment moment, Participant participant,
                                       PlayerHistory history, ContextSettings settings) {
        int available = history == null ? 0 : history.recentPerformance().size();
        if (available < settings.minPriorAppearances()) {
            throw new InsufficientHistoryException(participant.playerId(), available, settings.minPriorAppearances());
        }
        return build(moment, participant, history, settings, false);
    }

    /**
     * Builds a context from whatever history exists. With no prior appearances at
     * all the baseline falls back to the career average.
     */
    public static PlayerContext enrichLowConfidence(Moment moment, Participant participant,
                                                    PlayerHistory history, ContextSettings settings) {
        PlayerHistory safe = history == null ? PlayerHistory.empty(participant.playerId()) : history;
        return build(moment, participant, safe, settings, true);
    }

    /** Strict enrichment of every participant; the first shortfall aborts the moment. */
    public static List<PlayerContext> enrichAll(Moment moment, PlayerHistoryLookup lookup, ContextSettings settings) {
        return moment.participants().stream()
            .map(p -> enrich(moment, p, lookup.historyBefore(p.playerId(), p.role(), moment.occurredAt()), settings))
            .toList();
    }

    static double trailingBaseline(List<Double> recentPerformance, int window, double fallback) {
        int n = Math.min(window, recentPerformance.size());
        if (n == 0) return fallback;
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            sum += recentPerformance.get(i);
        }
        return sum / n;
    }

    private static PlayerContext build(Moment moment, Participant participant, PlayerHistory history,
                                       ContextSettings settings, boolean lowConfidence) {
        double seasons = CareerStageClassifier.seasonsPlayed(history, participant.role(), settings);
        CareerStage stage = CareerStageClassifier.classify(seasons, settings);
        int used = Math.min(settings.trailingWindow(), history.recentPerformance().size());
        double baseline = trailingBaseline(history.recentPerformance(), settings.trailingWindow(),
            history.careerAverage());

        double teamDelta = moment.teamDelta(moment.isHomeTeam(participant.role()));
        return new PlayerContext(
            moment.momentId(),
            participant.playerId(),
            participant.role(),
            stage,
            seasons,
            baseline,
            history.careerAverage(),
            used,
            Side.fromTeamDelta(teamDelta),
            teamDelta,
            lowConfidence);
    }
}
