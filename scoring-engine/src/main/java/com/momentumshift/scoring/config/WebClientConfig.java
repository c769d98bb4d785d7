package com.momentumshift.scoring.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * WebClients for the external collaborators. Each shares one connector whose
 * connect, response and read timeouts come from {@code services.timeout}, so a
 * slow collaborator surfaces as an error instead of a hung request.
 */
@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    @Value("${services.player-history.base-url}")
    private String playerHistoryUrl;

    @Value("${services.sentiment.base-url}")
    private String sentimentUrl;

    @Value("${services.ground-truth.base-url}")
    private String groundTruthUrl;

    @Value("${services.ledger.base-url}")
    private String ledgerUrl;

    @Value("${services.timeout:PT5S}")
    private Duration timeout;

    @Bean
    public WebClient playerHistoryClient(WebClient.Builder builder) {
        return build(builder, playerHistoryUrl, "player-history");
    }

    @Bean
    public WebClient sentimentClient(WebClient.Builder builder) {
        return build(builder, sentimentUrl, "sentiment");
    }

    @Bean
    public WebClient groundTruthClient(WebClient.Builder builder) {
        return build(builder, groundTruthUrl, "ground-truth");
    }

    @Bean
    public WebClient ledgerClient(WebClient.Builder builder) {
        return build(builder, ledgerUrl, "ledger");
    }

    private WebClient build(WebClient.Builder builder, String baseUrl, String collaborator) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis())
            .responseTimeout(timeout)
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(timeout.toMillis(), TimeUnit.MILLISECONDS))
            );

        // clone(): the injected builder is shared and mutable
        return builder.clone()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(serverErrorFilter(collaborator))
            .filter(loggingFilter(collaborator))
            .build();
    }

    private ExchangeFilterFunction serverErrorFilter(String collaborator) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return Mono.error(new RuntimeException(collaborator + " server error: " + clientResponse.statusCode()));
            }
            return Mono.just(clientResponse);
        });
    }

    private ExchangeFilterFunction loggingFilter(String collaborator) {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request. collaborator={} method={} url={}",
                      collaborator, clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
