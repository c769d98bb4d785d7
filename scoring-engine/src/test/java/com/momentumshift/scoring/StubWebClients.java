package com.momentumshift.scoring;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/** WebClients backed by an in-memory exchange function instead of a network. */
public final class StubWebClients {

    private StubWebClients() {}

    public static WebClient json(HttpStatus status, String body) {
        return routed(request -> response(status, body));
    }

    public static WebClient routed(Function<ClientRequest, ClientResponse> handler) {
        return WebClient.builder()
            .baseUrl("http://stub")
            .exchangeFunction(request -> Mono.just(handler.apply(request)))
            .build();
    }

    public static WebClient failing(Throwable error) {
        return WebClient.builder()
            .baseUrl("http://stub")
            .exchangeFunction(request -> Mono.error(error))
            .build();
    }

    /** Records each request it receives and answers 200 with an empty body. */
    public static WebClient recording(List<ClientRequest> sink) {
        return routed(request -> {
            sink.add(request);
            return ClientResponse.create(HttpStatus.OK).build();
        });
    }

    public static List<ClientRequest> newSink() {
        return new CopyOnWriteArrayList<>();
    }

    public static ClientResponse response(HttpStatus status, String body) {
        return ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build();
    }
}
