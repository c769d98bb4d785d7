package com.momentumshift.ledger.controller;

import com.momentumshift.common.ledger.WeightVersionEvent;
import com.momentumshift.common.model.MssResult;
import com.momentumshift.common.model.PredictionRecord;
import com.momentumshift.common.model.PredictionStatus;
import com.momentumshift.common.trace.RunContextUtil;
import com.momentumshift.ledger.dto.AppendResult;
import com.momentumshift.ledger.service.LedgerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/ledger")
public class LedgerController {

    private static final Logger log = LoggerFactory.getLogger(LedgerController.class);

    static final String UNSCOPED_RUN  = "unscoped";

    private final LedgerService ledgerService;

    public LedgerController(LedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    @PostMapping("/results")
    public Mono<ResponseEntity<AppendResult>> appendResults(
            @RequestHeader(value = RunContextUtil.RUN_ID_HEADER, required = false) String runId,
            @RequestBody List<MssResult> results) {
        String run = runId == null || runId.isBlank() ? UNSCOPED_RUN : runId;
        log.info("Received results for ledger. runId={} count={}", run, results.size());
        return ledgerService.appendResults(run, results)
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Results endpoint error. runId={}", run, e));
    }

    /** Responds 409 when any EVALUATED record was already recorded; the rest are still appended. */
    @PostMapping("/predictions")
    public Mono<ResponseEntity<AppendResult>> appendPredictions(
            @RequestHeader(value = RunContextUtil.RUN_ID_HEADER, required = false) String runId,
            @RequestBody List<PredictionRecord> records) {
        String run = runId == null || runId.isBlank() ? UNSCOPED_RUN : runId;
        log.info("Received prediction records for ledger. runId={} count={}", run, records.size());
        return ledgerService.appendPredictions(run, records)
            .map(r -> ResponseEntity.status(r.hasConflicts() ? HttpStatus.CONFLICT : HttpStatus.OK).body(r))
            .doOnError(e -> log.error("Predictions endpoint error. runId={}", run, e));
    }

    @PostMapping("/weights")
    public Mono<ResponseEntity<WeightVersionEvent>> appendWeights(@RequestBody WeightVersionEvent event) {
        log.info("Received weight version for ledger. version={}",
                 event.weights() == null ? null : event.weights().version());
        return ledgerService.appendWeights(event)
            .map(e -> ResponseEntity.status(HttpStatus.CREATED).body(e));
    }

    @GetMapping("/results")
    public Flux<MssResult> results(@RequestParam(required = false) String momentId,
                                   @RequestParam(required = false) String runId,
                                   @RequestParam(required = false) String weightVersion) {
        log.info("Results query received. momentId={} runId={} weightVersion={}", momentId, runId, weightVersion);
        return ledgerService.results(momentId, runId, weightVersion);
    }

    @GetMapping("/predictions")
    public Flux<PredictionRecord> predictions(@RequestParam(required = false) String momentId,
                                              @RequestParam(required = false) String modelVersion,
                                              @RequestParam(required = false) PredictionStatus status) {
        log.info("Predictions query received. momentId={} modelVersion={} status={}", momentId, modelVersion, status);
        return ledgerService.predictions(momentId, modelVersion, status);
    }

    @GetMapping("/predictions/unevaluated")
    public Flux<PredictionRecord> unevaluated() {
        log.info("Unevaluated predictions query received");
        return ledgerService.unevaluated();
    }

    @GetMapping("/weights")
    public Flux<WeightVersionEvent> weights() {
        log.info("Weight versions query received");
        return ledgerService.weightVersions();
    }

    @GetMapping("/weights/{version}")
    public Mono<ResponseEntity<WeightVersionEvent>> weight(@PathVariable String version) {
        log.info("Weight version query received. version={}", version);
        return ledgerService.weightVersion(version).map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, String>>> health() {
        return Mono.just(ResponseEntity.ok(Map.of("status", "UP", "service", "ledger-service")));
    }
}
