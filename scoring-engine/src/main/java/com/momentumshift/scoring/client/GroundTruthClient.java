package com.momentumshift.scoring.client;

import com.momentumshift.common.exception.CollaboratorException;
import com.momentumshift.common.model.ObservedOutcome;
import com.momentumshift.common.model.PredictionRecord;
import com.momentumshift.common.trace.RunContextUtil;
import com.momentumshift.scoring.dto.OutcomeQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Reads realized post-moment performance for a batch of prediction records.
 * Records without an outcome are simply absent from the response; the evaluator
 * reports them as missing.
 */
@Component
public class GroundTruthClient {

    static final String COLLABORATOR = "ground-truth";

    private static final Logger log = LoggerFactory.getLogger(GroundTruthClient.class);

    private final WebClient groundTruthClient;

    public GroundTruthClient(WebClient groundTruthClient) {
        this.groundTruthClient = groundTruthClient;
    }

    public Mono<List<ObservedOutcome>> fetch(List<PredictionRecord> records, int horizon, String runId) {
        if (records.isEmpty()) {
            return Mono.just(List.of());
        }
        List<OutcomeQuery> queries = records.stream()
            .map(r -> new OutcomeQuery(r.momentId(), r.playerId(), horizon))
            .distinct()
            .toList();
        return groundTruthClient.post()
            .uri("/api/v1/outcomes/query")
            .header(RunContextUtil.RUN_ID_HEADER, runId)
            .bodyValue(queries)
            .retrieve()
            .bodyToMono(new ParameterizedTypeReference<List<ObservedOutcome>>() {})
            .defaultIfEmpty(List.of())
            .doOnNext(list -> log.info("Ground truth fetched. requested={} received={} runId={}",
                                       queries.size(), list.size(), runId))
            .onErrorMap(e -> !(e instanceof CollaboratorException), e -> {
                log.warn("Ground truth fetch failed. requested={} runId={} reason={}",
                         queries.size(), runId, e.getMessage());
                return new CollaboratorException(COLLABORATOR, "outcome lookup failed: " + e.getMessage(), e);
            });
    }
}
