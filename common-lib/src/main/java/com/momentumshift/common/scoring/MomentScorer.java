package com.momentumshift.common.scoring;

import com.momentumshift.common.composer.ScoreComposer;
import com.momentumshift.common.context.ContextEnricher;
import com.momentumshift.common.context.ContextMultiplierFunction;
import com.momentumshift.common.context.PlayerHistoryLookup;
import com.momentumshift.common.exception.InsufficientHistoryException;
import com.momentumshift.common.model.ComposerWeights;
import com.momentumshift.common.model.Moment;
import com.momentumshift.common.model.MssResult;
import com.momentumshift.common.model.Participant;
import com.momentumshift.common.model.PlayerContext;
import com.momentumshift.common.model.PlayerHistory;
import com.momentumshift.common.model.SentimentObservation;
import com.momentumshift.common.model.SentimentSignal;
import com.momentumshift.common.sentiment.SentimentAggregator;
import com.momentumshift.common.settings.MssSettings;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs stages 4.2–4.5 for a single moment.
 *
 * <p>All participant contexts are resolved first; only when every context is
 * settled are the scores composed. Under the FAIL policy an
 * {@link InsufficientHistoryException} therefore leaves no partial output behind.
 *
 * <p>Holds no state across calls; one moment never observes another, so moments
 * may be scored on parallel workers.
 */
public final class MomentScorer {

    private MomentScorer() {}

    public static ScoringOutcome score(Moment moment,
                                       PlayerHistoryLookup historyLookup,
                                       List<SentimentObservation> observations,
                                       MssSettings settings,
                                       ComposerWeights weights,
                                       ContextMultiplierFunction multiplierFunction) {
        List<PlayerContext> contexts = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        for (Participant participant : moment.participants()) {
            PlayerHistory history = historyLookup.historyBefore(
                participant.playerId(), participant.role(), moment.occurredAt());
            try {
                contexts.add(ContextEnricher.enrich(moment, participant, history, settings.context()));
            } catch (InsufficientHistoryException e) {
                switch (settings.insufficientHistoryPolicy()) {
                    case FAIL -> throw e;
                    case SKIP -> skipped.add(participant.playerId());
                    case FLAG -> contexts.add(
                        ContextEnricher.enrichLowConfidence(moment, participant, history, settings.context()));
                }
            }
        }

        List<MssResult> results = new ArrayList<>(contexts.size());
        for (PlayerContext context : contexts) {
            SentimentSignal signal = SentimentAggregator.aggregate(
                moment.momentId(), context.playerId(), observations, settings.sentiment());
            results.add(ScoreComposer.compose(moment, context, signal, weights, settings.impact(), multiplierFunction));
        }
        return new ScoringOutcome(moment.momentId(), results, skipped);
    }
}
