package com.momentumshift.scoring.client;

import com.momentumshift.common.exception.CollaboratorException;
import com.momentumshift.common.model.SentimentObservation;
import com.momentumshift.common.trace.RunContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Reads pre-scored sentiment observations for a moment. No observations (empty
 * body or 404) is normal and yields an empty list; a failing source is a
 * {@link CollaboratorException}.
 */
@Component
public class SentimentClient {

    static final String COLLABORATOR = "sentiment";

    private static final Logger log = LoggerFactory.getLogger(SentimentClient.class);

    private final WebClient sentimentClient;

    public SentimentClient(WebClient sentimentClient) {
        this.sentimentClient = sentimentClient;
    }

    public Mono<List<SentimentObservation>> fetch(String momentId, String runId) {
        return sentimentClient.get()
            .uri(uri -> uri.path("/api/v1/sentiment").queryParam("momentId", momentId).build())
            .header(RunContextUtil.RUN_ID_HEADER, runId)
            .retrieve()
            .bodyToMono(new ParameterizedTypeReference<List<SentimentObservation>>() {})
            .defaultIfEmpty(List.of())
            .doOnNext(list -> log.debug("Sentiment fetched. momentId={} observations={} runId={}",
                                        momentId, list.size(), runId))
            .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.just(List.of()))
            .onErrorMap(e -> !(e instanceof CollaboratorException), e -> {
                log.warn("Sentiment fetch failed. momentId={} runId={} reason={}", momentId, runId, e.getMessage());
                return new CollaboratorException(COLLABORATOR,
                    "sentiment lookup failed for moment " + momentId + ": " + e.getMessage(), e);
            });
    }
}
