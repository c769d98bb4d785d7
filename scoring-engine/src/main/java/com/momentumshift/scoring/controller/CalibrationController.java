package com.momentumshift.scoring.controller;

import com.momentumshift.common.calibration.RefitResult;
import com.momentumshift.common.model.CalibrationReport;
import com.momentumshift.common.model.ComposerWeights;
import com.momentumshift.common.predict.VersionedModel;
import com.momentumshift.common.trace.RunContextUtil;
import com.momentumshift.scoring.dto.EvaluateRequest;
import com.momentumshift.scoring.dto.RefitRequest;
import com.momentumshift.scoring.dto.TrainRequest;
import com.momentumshift.scoring.service.CalibrationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
public class CalibrationController {

    private static final Logger log = LoggerFactory.getLogger(CalibrationController.class);

    private final CalibrationService calibrationService;

    public CalibrationController(CalibrationService calibrationService) {
        this.calibrationService = calibrationService;
    }

    @PostMapping("/calibration/evaluate")
    public Mono<ResponseEntity<CalibrationReport>> evaluate(
            @RequestBody EvaluateRequest request,
            @RequestHeader(value = RunContextUtil.RUN_ID_HEADER, required = false) String runIdHeader) {
        String runId = RunIds.orNew(runIdHeader);
        log.info("Evaluate request received. records={} runId={}", request.records().size(), runId);
        return RunContextUtil.withRunId(calibrationService.evaluate(request).map(ResponseEntity::ok), runId);
    }

    @PostMapping("/calibration/refit")
    public Mono<ResponseEntity<RefitResult>> refit(
            @RequestBody RefitRequest request,
            @RequestHeader(value = RunContextUtil.RUN_ID_HEADER, required = false) String runIdHeader) {
        String runId = RunIds.orNew(runIdHeader);
        log.info("Refit request received. records={} weightVersion={} modelVersion={} runId={}",
                 request.records().size(), request.weightVersion(), request.modelVersion(), runId);
        return RunContextUtil.withRunId(calibrationService.refit(request).map(ResponseEntity::ok), runId);
    }

    @PostMapping("/models/train")
    public Mono<ResponseEntity<VersionedModel>> train(@RequestBody TrainRequest request) {
        log.info("Train request received. examples={}", request.examples().size());
        return calibrationService.train(request).map(ResponseEntity::ok);
    }

    @GetMapping("/versions/weights")
    public ResponseEntity<List<ComposerWeights>> weightVersions() {
        return ResponseEntity.ok(calibrationService.weightVersions());
    }

    @GetMapping("/versions/models")
    public ResponseEntity<List<VersionedModel>> modelVersions() {
        return ResponseEntity.ok(calibrationService.modelVersions());
    }
}
