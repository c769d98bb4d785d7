package com.momentumshift.ledger.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.momentumshift.common.exception.UnknownVersionException;
import com.momentumshift.common.ledger.WeightVersionEvent;
import com.momentumshift.common.model.ComposerWeights;
import com.momentumshift.common.model.MssResult;
import com.momentumshift.common.model.PredictionRecord;
import com.momentumshift.common.model.PredictionStatus;
import com.momentumshift.ledger.dto.AppendResult;
import com.momentumshift.ledger.model.MssResultEntry;
import com.momentumshift.ledger.model.PredictionEntry;
import com.momentumshift.ledger.model.WeightVersionEntry;
import com.momentumshift.ledger.repository.MssResultEntryRepository;
import com.momentumshift.ledger.repository.PredictionEntryRepository;
import com.momentumshift.ledger.repository.WeightVersionEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only persistence of issued results, prediction records and weight versions.
 *
 * <p>Rows are inserted, never updated. Re-delivery of an identical key is accepted
 * idempotently; a second EVALUATED row for the same prediction is refused so an
 * evaluation can never be silently replaced.
 */
@Service
public class LedgerService {

    private static final Logger log = LoggerFactory.getLogger(LedgerService.class);

    private enum Append { APPENDED, DUPLICATE, REJECTED }

    private record Appended(String key, Append outcome) {}

    @Value("${ledger.query-limit:500}")
    private int queryLimit = 500;

    private final MssResultEntryRepository resultRepository;
    private final PredictionEntryRepository predictionRepository;
    private final WeightVersionEntryRepository weightRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public LedgerService(MssResultEntryRepository resultRepository,
                         PredictionEntryRepository predictionRepository,
                         WeightVersionEntryRepository weightRepository,
                         ObjectMapper objectMapper,
                         Clock clock) {
        this.resultRepository     = resultRepository;
        this.predictionRepository = predictionRepository;
        this.weightRepository     = weightRepository;
        this.objectMapper         = objectMapper;
        this.clock                = clock;
    }

    // ── results ─────────────────────────────────────────────────────────────

    public Mono<AppendResult> appendResults(String runId, List<MssResult> results) {
        return Flux.fromIterable(results)
            .concatMap(result -> {
                String key = result.key() + "|" + result.weightVersion();
                return resultRepository.existsByRunIdAndMomentIdAndPlayerIdAndWeightVersion(
                        runId, result.momentId(), result.playerId(), result.weightVersion())
                    .flatMap(exists -> exists
                        ? Mono.just(new Appended(key, Append.DUPLICATE))
                        : Mono.fromCallable(() -> toEntity(runId, result))
                            .flatMap(resultRepository::save)
                            .thenReturn(new Appended(key, Append.APPENDED)))
                    .onErrorResume(DataIntegrityViolationException.class,
                        e -> Mono.just(new Appended(key, Append.DUPLICATE)));
            })
            .collectList()
            .map(this::summarise)
            .doOnSuccess(r -> log.info("Results appended. runId={} appended={} duplicates={}",
                                       runId, r.appended(), r.duplicates().size()))
            .doOnError(e -> log.error("Failed to append results. runId={}", runId, e));
    }

    public Flux<MssResult> results(String momentId, String runId, String weightVersion) {
        Flux<MssResultEntry> rows;
        if (momentId != null) {
            rows = resultRepository.findByMomentIdOrderByRecordedAtAsc(momentId)
                .filter(e -> weightVersion == null || weightVersion.equals(e.getWeightVersion()))
                .filter(e -> runId == null || runId.equals(e.getRunId()));
        } else if (runId != null) {
            rows = resultRepository.findByRunIdOrderByMomentIdAscPlayerIdAsc(runId)
                .filter(e -> weightVersion == null || weightVersion.equals(e.getWeightVersion()));
        } else if (weightVersion != null) {
            rows = resultRepository.findByWeightVersion(weightVersion, queryLimit);
        } else {
            return Flux.error(new IllegalArgumentException("one of momentId, runId or weightVersion is required"));
        }
        return rows.concatMap(e -> decode(e.getPayload(), MssResult.class));
    }

    // ── predictions ─────────────────────────────────────────────────────────

    public Mono<AppendResult> appendPredictions(String runId, List<PredictionRecord> records) {
        return Flux.fromIterable(records)
            .concatMap(record -> {
                String key = record.key() + "|" + record.weightVersion() + "|" + record.modelVersion();
                boolean evaluated = record.status() == PredictionStatus.EVALUATED;
                return predictionRepository.existsByMomentIdAndPlayerIdAndWeightVersionAndModelVersionAndStatus(
                        record.momentId(), record.playerId(), record.weightVersion(),
                        record.modelVersion(), record.status().name())
                    .flatMap(exists -> {
                        if (exists) {
                            return Mono.just(new Appended(key, evaluated ? Append.REJECTED : Append.DUPLICATE));
                        }
                        return Mono.fromCallable(() -> toEntity(runId, record))
                            .flatMap(predictionRepository::save)
                            .thenReturn(new Appended(key, Append.APPENDED));
                    })
                    .onErrorResume(DataIntegrityViolationException.class,
                        e -> Mono.just(new Appended(key, evaluated ? Append.REJECTED : Append.DUPLICATE)));
            })
            .collectList()
            .map(this::summarise)
            .doOnSuccess(r -> {
                if (r.hasConflicts()) {
                    log.warn("Second evaluation refused. runId={} rejected={}", runId, r.rejected());
                }
                log.info("Predictions appended. runId={} appended={} duplicates={} rejected={}",
                         runId, r.appended(), r.duplicates().size(), r.rejected().size());
            })
            .doOnError(e -> log.error("Failed to append predictions. runId={}", runId, e));
    }

    public Flux<PredictionRecord> predictions(String momentId, String modelVersion, PredictionStatus status) {
        Flux<PredictionEntry> rows;
        if (momentId != null) {
            rows = predictionRepository.findByMomentIdOrderByRecordedAtAsc(momentId)
                .filter(e -> modelVersion == null || modelVersion.equals(e.getModelVersion()));
        } else if (modelVersion != null) {
            rows = predictionRepository.findByModelVersion(modelVersion, queryLimit);
        } else {
            return Flux.error(new IllegalArgumentException("one of momentId or modelVersion is required"));
        }
        return rows
            .filter(e -> status == null || status.name().equals(e.getStatus()))
            .concatMap(e -> decode(e.getPayload(), PredictionRecord.class));
    }

    public Flux<PredictionRecord> unevaluated() {
        return predictionRepository.findUnevaluated(queryLimit)
            .concatMap(e -> decode(e.getPayload(), PredictionRecord.class));
    }

    // ── weight versions ─────────────────────────────────────────────────────

    public Mono<WeightVersionEvent> appendWeights(WeightVersionEvent event) {
        if (event == null || event.weights() == null) {
            return Mono.error(new IllegalArgumentException("weights are required"));
        }
        ComposerWeights weights = event.weights();
        return weightRepository.existsByVersion(weights.version())
            .flatMap(exists -> exists
                ? Mono.<WeightVersionEvent>error(new LedgerConflictException(
                    "weight version already recorded: " + weights.version()))
                : weightRepository.save(toEntity(event)).thenReturn(event))
            .onErrorMap(DataIntegrityViolationException.class,
                e -> new LedgerConflictException("weight version already recorded: " + weights.version()))
            .doOnSuccess(e -> log.info("Weight version recorded. version={} parent={} w1={} w2={}",
                                       weights.version(), weights.parentVersion(), weights.w1(), weights.w2()));
    }

    public Flux<WeightVersionEvent> weightVersions() {
        return weightRepository.findAllByOrderByCreatedAtAsc().map(LedgerService::toEvent);
    }

    public Mono<WeightVersionEvent> weightVersion(String version) {
        return weightRepository.findByVersion(version)
            .map(LedgerService::toEvent)
            .switchIfEmpty(Mono.error(() -> new UnknownVersionException("weights", version)));
    }

    // ── mapping ─────────────────────────────────────────────────────────────

    private AppendResult summarise(List<Appended> outcomes) {
        int appended = 0;
        List<String> duplicates = new ArrayList<>();
        List<String> rejected = new ArrayList<>();
        for (Appended a : outcomes) {
            switch (a.outcome()) {
                case APPENDED  -> appended++;
                case DUPLICATE -> duplicates.add(a.key());
                case REJECTED  -> rejected.add(a.key());
            }
        }
        return new AppendResult(appended, duplicates, rejected);
    }

    private MssResultEntry toEntity(String runId, MssResult result) throws Exception {
        MssResultEntry e = new MssResultEntry();
        e.setRunId(runId);
        e.setMomentId(result.momentId());
        e.setPlayerId(result.playerId());
        e.setRole(result.role().name());
        e.setSide(result.side().name());
        e.setWeightVersion(result.weightVersion());
        e.setStatisticalComponent(result.statisticalComponent());
        e.setNarrativeComponent(result.narrativeComponent());
        e.setContextMultiplier(result.contextMultiplier());
        e.setBaseline(result.baseline());
        e.setScore(result.score());
        e.setPayload(objectMapper.writeValueAsString(result));
        e.setRecordedAt(now());
        return e;
    }

    private PredictionEntry toEntity(String runId, PredictionRecord record) throws Exception {
        PredictionEntry e = new PredictionEntry();
        e.setRunId(runId);
        e.setMomentId(record.momentId());
        e.setPlayerId(record.playerId());
        e.setWeightVersion(record.weightVersion());
        e.setModelVersion(record.modelVersion());
        e.setStatus(record.status().name());
        e.setScore(record.score());
        e.setMeanAbsoluteError(record.meanAbsoluteError());
        e.setPayload(objectMapper.writeValueAsString(record));
        e.setRecordedAt(now());
        return e;
    }

    private WeightVersionEntry toEntity(WeightVersionEvent event) {
        ComposerWeights w = event.weights();
        WeightVersionEntry e = new WeightVersionEntry();
        e.setVersion(w.version());
        e.setParentVersion(w.parentVersion());
        e.setW1(w.w1());
        e.setW2(w.w2());
        e.setReason(event.reason());
        e.setCreatedAt(w.createdAt() == null ? now() : LocalDateTime.ofInstant(w.createdAt(), ZoneOffset.UTC));
        e.setRecordedAt(now());
        return e;
    }

    private static WeightVersionEvent toEvent(WeightVersionEntry e) {
        return new WeightVersionEvent(
            new ComposerWeights(e.getVersion(), e.getW1(), e.getW2(), e.getParentVersion(),
                e.getCreatedAt() == null ? null : e.getCreatedAt().toInstant(ZoneOffset.UTC)),
            e.getReason());
    }

    private <T> Mono<T> decode(String payload, Class<T> type) {
        return Mono.fromCallable(() -> objectMapper.readValue(payload, type));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
