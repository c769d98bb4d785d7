package com.momentumshift.scoring.client;

import com.momentumshift.common.exception.CollaboratorException;
import com.momentumshift.common.model.Moment;
import com.momentumshift.common.model.PlayerHistory;
import com.momentumshift.common.model.PlayerRole;
import com.momentumshift.common.trace.RunContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;

/**
 * Reads trailing-window player history from the player-history store.
 *
 * <p>An unknown player (404) is not a failure: it yields an empty history so the
 * enricher can apply the insufficient-history policy. Every other error, timeouts
 * included, is raised as {@link CollaboratorException}.
 */
@Component
public class PlayerHistoryClient {

    static final String COLLABORATOR = "player-history";

    private static final Logger log = LoggerFactory.getLogger(PlayerHistoryClient.class);

    private final WebClient playerHistoryClient;

    public PlayerHistoryClient(WebClient playerHistoryClient) {
        this.playerHistoryClient = playerHistoryClient;
    }

    public Mono<PlayerHistory> fetch(String playerId, PlayerRole role, Instant before, int window, String runId) {
        return playerHistoryClient.get()
            .uri(uri -> uri.path("/api/v1/players/{playerId}/history")
                .queryParam("role", role)
                .queryParam("before", before)
                .queryParam("window", window)
                .build(playerId))
            .header(RunContextUtil.RUN_ID_HEADER, runId)
            .retrieve()
            .bodyToMono(PlayerHistory.class)
            .defaultIfEmpty(PlayerHistory.empty(playerId))
            .doOnNext(h -> log.debug("Player history fetched. playerId={} appearances={} runId={}",
                                     playerId, h.recentPerformance().size(), runId))
            .onErrorResume(WebClientResponseException.NotFound.class,
                e -> Mono.just(PlayerHistory.empty(playerId)))
            .onErrorMap(e -> !(e instanceof CollaboratorException), e -> {
                log.warn("Player history fetch failed. playerId={} runId={} reason={}",
                         playerId, runId, e.getMessage());
                return new CollaboratorException(COLLABORATOR,
                    "history lookup failed for player " + playerId + ": " + e.getMessage(), e);
            });
    }

    /** Fetches every participant of {@code moment} concurrently, keyed by player id. */
    public Mono<Map<String, PlayerHistory>> fetchParticipants(Moment moment, int window, String runId) {
        return Flux.fromIterable(moment.participants())
            .flatMap(p -> fetch(p.playerId(), p.role(), moment.occurredAt(), window, runId)
                .map(h -> Map.entry(p.playerId(), h)))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue);
    }
}
