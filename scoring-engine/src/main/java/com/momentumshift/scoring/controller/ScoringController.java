package com.momentumshift.scoring.controller;

import com.momentumshift.common.model.Moment;
import com.momentumshift.common.model.PredictionRecord;
import com.momentumshift.common.model.RawMomentEvent;
import com.momentumshift.common.scoring.ScoringOutcome;
import com.momentumshift.common.stats.RealizedShift;
import com.momentumshift.common.trace.RunContextUtil;
import com.momentumshift.scoring.dto.BatchScoreRequest;
import com.momentumshift.scoring.dto.BatchScoreResponse;
import com.momentumshift.scoring.dto.PredictRequest;
import com.momentumshift.scoring.dto.RealizedShiftRequest;
import com.momentumshift.scoring.dto.ScoreRequest;
import com.momentumshift.scoring.service.MomentScoringService;
import com.momentumshift.scoring.service.PredictionService;
import com.momentumshift.scoring.service.RealizedShiftService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1")
public class ScoringController {

    private static final Logger log = LoggerFactory.getLogger(ScoringController.class);

    private final MomentScoringService scoringService;
    private final PredictionService predictionService;
    private final RealizedShiftService realizedShiftService;

    public ScoringController(MomentScoringService scoringService,
                             PredictionService predictionService,
                             RealizedShiftService realizedShiftService) {
        this.scoringService       = scoringService;
        this.predictionService    = predictionService;
        this.realizedShiftService = realizedShiftService;
    }

    @PostMapping("/moments")
    public Mono<ResponseEntity<Moment>> buildMoment(
            @RequestBody RawMomentEvent event,
            @RequestHeader(value = RunContextUtil.RUN_ID_HEADER, required = false) String runIdHeader) {
        String runId = RunIds.orNew(runIdHeader);
        return RunContextUtil.withRunId(scoringService.buildMoment(event).map(ResponseEntity::ok), runId);
    }

    @PostMapping("/score")
    public Mono<ResponseEntity<ScoringOutcome>> score(
            @RequestBody ScoreRequest request,
            @RequestHeader(value = RunContextUtil.RUN_ID_HEADER, required = false) String runIdHeader) {
        String runId = RunIds.orNew(runIdHeader);
        log.info("Score request received. momentId={} runId={}", request.momentId(), runId);
        return RunContextUtil.withRunId(scoringService.score(request).map(ResponseEntity::ok), runId);
    }

    @PostMapping("/score/batch")
    public Mono<ResponseEntity<BatchScoreResponse>> scoreBatch(
            @RequestBody BatchScoreRequest request,
            @RequestHeader(value = RunContextUtil.RUN_ID_HEADER, required = false) String runIdHeader) {
        String runId = RunIds.orNew(runIdHeader);
        log.info("Batch score request received. moments={} runId={}", request.moments().size(), runId);
        return RunContextUtil.withRunId(scoringService.scoreBatch(request).map(ResponseEntity::ok), runId);
    }

    @PostMapping("/predict")
    public Mono<ResponseEntity<PredictionRecord>> predict(
            @RequestBody PredictRequest request,
            @RequestHeader(value = RunContextUtil.RUN_ID_HEADER, required = false) String runIdHeader) {
        String runId = RunIds.orNew(runIdHeader);
        return RunContextUtil.withRunId(predictionService.predict(request).map(ResponseEntity::ok), runId);
    }

    @PostMapping("/realized-shift")
    public Mono<ResponseEntity<RealizedShift>> realizedShift(@RequestBody RealizedShiftRequest request) {
        return realizedShiftService.compute(request).map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
