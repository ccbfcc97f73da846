package com.modelhealth.client;

import com.modelhealth.exception.MlApiException;
import com.modelhealth.exception.MlApiUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.util.Map;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class MlApiClient {

    @Value("${ml.api.base-url}")
    private String baseUrl;

    @Value("${ml.api.timeout-seconds:10}")
    private int timeoutSeconds;

    @Value("${ml.api.train-timeout-seconds:600}")
    private int trainTimeoutSeconds;

    private WebClient webClient;
    private WebClient trainingClient;

    @PostConstruct
    void init() {
        this.webClient = buildClient(timeoutSeconds);
        this.trainingClient = buildClient(trainTimeoutSeconds);
        log.info("MlApiClient initialised → {}", baseUrl);
    }

    public Mono<MlTrainResult> train(String requestId) {
        return trainingClient.post().uri("/train")
            .header("X-Request-ID", requestId)
            .bodyValue(Map.of("requestId", requestId))
            .retrieve()
            .onStatus(HttpStatusCode::is4xxClientError, resp ->
                resp.bodyToMono(String.class).map(b -> new MlApiException("ML API rejected training request (4xx): " + b)))
            .onStatus(HttpStatusCode::is5xxServerError, resp ->
                resp.bodyToMono(String.class).map(b -> new MlApiUnavailableException(new RuntimeException(b))))
            .bodyToMono(JsonNode.class)
            .map(this::toTrainResult)
            .onErrorMap(WebClientRequestException.class, MlApiUnavailableException::new);
    }

    public Mono<Boolean> isHealthy() {
        return webClient.get().uri("/health").retrieve()
            .bodyToMono(JsonNode.class)
            .map(json -> json.hasNonNull("status") && "ok".equals(json.get("status").asText()))
            .onErrorReturn(false);
    }

    private WebClient buildClient(int readTimeoutSeconds) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler(readTimeoutSeconds, TimeUnit.SECONDS)));
        return WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader("Content-Type", "application/json")
            .build();
    }

    private MlTrainResult toTrainResult(JsonNode json) {
        if (json == null || !json.hasNonNull("mae")) {
            throw new MlApiException("ML API training response missing 'mae': " + String.valueOf(json));
        }
        double mae = json.get("mae").asDouble();
        Long samples = json.hasNonNull("training_samples") ? json.get("training_samples").asLong() : null;
        String version = json.hasNonNull("model_version") ? json.get("model_version").asText() : null;
        return new MlTrainResult(mae, samples, version);
    }

    public record MlTrainResult(double mae, Long trainingSamples, String modelVersion) {}
}
