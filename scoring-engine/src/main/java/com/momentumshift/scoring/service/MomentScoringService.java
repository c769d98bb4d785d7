package com.momentumshift.scoring.service;

import com.momentumshift.common.context.ContextMultiplierFunction;
import com.momentumshift.common.context.PlayerHistoryLookup;
import com.momentumshift.common.ledger.LedgerPublisher;
import com.momentumshift.common.model.ComposerWeights;
import com.momentumshift.common.model.Moment;
import com.momentumshift.common.model.PlayerHistory;
import com.momentumshift.common.model.RawMomentEvent;
import com.momentumshift.common.model.SentimentObservation;
import com.momentumshift.common.moment.MomentRecordBuilder;
import com.momentumshift.common.scoring.MomentScorer;
import com.momentumshift.common.scoring.ScoringOutcome;
import com.momentumshift.common.settings.MssSettings;
import com.momentumshift.common.trace.RunContextUtil;
import com.momentumshift.scoring.client.PlayerHistoryClient;
import com.momentumshift.scoring.client.SentimentClient;
import com.momentumshift.scoring.dto.BatchScoreRequest;
import com.momentumshift.scoring.dto.BatchScoreResponse;
import com.momentumshift.scoring.dto.ErrorResponse;
import com.momentumshift.scoring.dto.MomentScoreEntry;
import com.momentumshift.scoring.dto.ScoreRequest;
import com.momentumshift.scoring.logger.PipelineStageLogger;
import com.momentumshift.scoring.registry.WeightRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Runs stages 4.1–4.5 for one moment or for a batch.
 *
 * <p>Collaborator reads happen first and reactively; the pure scorer then runs on
 * {@code boundedElastic} with every input already in memory. In a batch each moment
 * is an independent task: a failing moment becomes an error entry and never aborts
 * the others. Entries are reported sorted by moment id.
 */
@Service
public class MomentScoringService {

    private static final Logger log = LoggerFactory.getLogger(MomentScoringService.class);

    @Value("${mss.batch.concurrency:8}")
    private int batchConcurrency = 8;

    private final MssSettings settings;
    private final WeightRegistry weightRegistry;
    private final ContextMultiplierFunction multiplierFunction;
    private final PlayerHistoryClient playerHistoryClient;
    private final SentimentClient sentimentClient;
    private final LedgerPublisher ledgerPublisher;
    private final PipelineStageLogger stageLogger;

    public MomentScoringService(MssSettings settings,
                                WeightRegistry weightRegistry,
                                ContextMultiplierFunction multiplierFunction,
                                PlayerHistoryClient playerHistoryClient,
                                SentimentClient sentimentClient,
                                LedgerPublisher ledgerPublisher,
                                PipelineStageLogger stageLogger) {
        this.settings            = settings;
        this.weightRegistry      = weightRegistry;
        this.multiplierFunction  = multiplierFunction;
        this.playerHistoryClient = playerHistoryClient;
        this.sentimentClient     = sentimentClient;
        this.ledgerPublisher     = ledgerPublisher;
        this.stageLogger         = stageLogger;
    }

    public Mono<Moment> buildMoment(RawMomentEvent raw) {
        return Mono.fromCallable(() -> MomentRecordBuilder.build(raw))
            .doOnEach(stageLogger.stage(PipelineStageLogger.MOMENT_BUILT, Moment::momentId));
    }

    public Mono<ScoringOutcome> score(ScoreRequest request) {
        return Mono.defer(() -> scoreWith(request, weightRegistry.resolve(request.weightVersion())));
    }

    public Mono<BatchScoreResponse> scoreBatch(BatchScoreRequest request) {
        return Mono.defer(() -> {
            ComposerWeights weights = weightRegistry.resolve(request.weightVersion());
            return RunContextUtil.currentRunId().flatMap(runId -> {
                log.info("Batch scoring started. moments={} weightVersion={} runId={}",
                         request.moments().size(), weights.version(), runId);
                return Flux.fromIterable(request.moments())
                    .flatMap(item -> scoreWith(item, weights)
                        .map(MomentScoreEntry::scored)
                        .onErrorResume(e -> {
                            log.warn("Moment rejected. momentId={} runId={} reason={}",
                                     item.momentId(), runId, e.getMessage());
                            return Mono.just(MomentScoreEntry.failed(item.momentId(), ErrorResponse.from(e)));
                        }), batchConcurrency)
                    .collectSortedList(Comparator.comparing(MomentScoreEntry::momentId))
                    .map(entries -> {
                        int scored = (int) entries.stream().filter(MomentScoreEntry::succeeded).count();
                        log.info("Batch scoring complete. scored={} failed={} runId={}",
                                 scored, entries.size() - scored, runId);
                        return new BatchScoreResponse(runId, weights.version(), scored,
                            entries.size() - scored, entries);
                    });
            });
        });
    }

    private Mono<ScoringOutcome> scoreWith(ScoreRequest request, ComposerWeights weights) {
        return RunContextUtil.currentRunId().flatMap(runId ->
            buildMoment(request.event())
                .flatMap(moment -> Mono.zip(histories(request, moment, runId), sentiment(request, moment, runId))
                    .doOnEach(stageLogger.stage(PipelineStageLogger.CONTEXT_ENRICHED, t -> moment.momentId()))
                    .flatMap(inputs -> Mono.fromCallable(() -> MomentScorer.score(
                            moment, lookup(inputs.getT1()), inputs.getT2(), settings, weights, multiplierFunction))
                        .subscribeOn(Schedulers.boundedElastic())))
                .doOnEach(stageLogger.stage(PipelineStageLogger.SCORE_COMPOSED, ScoringOutcome::momentId))
                .doOnNext(outcome -> {
                    log.info("Moment scored. momentId={} results={} skipped={} weightVersion={} runId={}",
                             outcome.momentId(), outcome.results().size(), outcome.skippedPlayers().size(),
                             weights.version(), runId);
                    ledgerPublisher.publishResults(runId, outcome.results());
                }));
    }

    private Mono<Map<String, PlayerHistory>> histories(ScoreRequest request, Moment moment, String runId) {
        if (request.histories() != null) {
            return Mono.just(request.histories());
        }
        return playerHistoryClient.fetchParticipants(moment, settings.context().trailingWindow(), runId);
    }

    private Mono<List<SentimentObservation>> sentiment(ScoreRequest request, Moment moment, String runId) {
        if (request.sentiment() != null) {
            return Mono.just(request.sentiment());
        }
        return sentimentClient.fetch(moment.momentId(), runId);
    }

    static PlayerHistoryLookup lookup(Map<String, PlayerHistory> histories) {
        return (playerId, role, before) -> histories.get(playerId);
    }
}
