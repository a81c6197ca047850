package com.driftmonitor.client;

import com.driftmonitor.config.RetrainingProperties;
import com.driftmonitor.exception.RetrainingTriggerException;
import com.driftmonitor.exception.RetrainingUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Notifies the external training pipeline that a model should be retrained. The pipeline
 * decides how; this client only delivers the drift evidence and reads back its job id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetrainingTriggerClient {

    private final RetrainingProperties properties;

    private WebClient webClient;
    private final ObjectMapper mapper = new ObjectMapper();

    @PostConstruct
    void init() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler(properties.getTimeoutSeconds(), TimeUnit.SECONDS)));
        this.webClient = WebClient.builder()
            .baseUrl(properties.getBaseUrl())
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader("Content-Type", "application/json")
            .build();
        log.info("RetrainingTriggerClient initialised → {} | enabled={}",
                 properties.getBaseUrl(), properties.isEnabled());
    }

    public Mono<RetrainingAck> trigger(RetrainingRequest request, String requestId) {
        return webClient.post().uri("/retrain")
            .header("X-Request-ID", requestId)
            .bodyValue(buildBody(request))
            .retrieve()
            .onStatus(HttpStatusCode::is4xxClientError, resp ->
                resp.bodyToMono(String.class).defaultIfEmpty("")
                    .map(b -> new RetrainingTriggerException("Training pipeline rejected request (4xx): " + b)))
            .onStatus(HttpStatusCode::is5xxServerError, resp ->
                resp.bodyToMono(String.class).defaultIfEmpty("")
                    .map(b -> new RetrainingUnavailableException(new RuntimeException(b))))
            .bodyToMono(JsonNode.class)
            .map(this::toAck)
            .retryWhen(Retry.backoff(properties.getMaxRetries(), Duration.ofMillis(300))
                .filter(ex -> ex instanceof WebClientRequestException)
                .onRetryExhaustedThrow((backoff, signal) -> new RetrainingUnavailableException(signal.failure())))
            .onErrorMap(WebClientRequestException.class, RetrainingUnavailableException::new);
    }

    public Mono<Boolean> isHealthy() {
        return webClient.get().uri("/health").retrieve()
            .bodyToMono(JsonNode.class)
            .map(json -> json.hasNonNull("status") && "ok".equals(json.get("status").asText()))
            .onErrorReturn(false);
    }

    private RetrainingAck toAck(JsonNode json) {
        if (json == null || !json.hasNonNull("job_id")) {
            throw new RetrainingTriggerException("Training pipeline response missing 'job_id': " + json);
        }
        String status = json.hasNonNull("status") ? json.get("status").asText() : "accepted";
        return new RetrainingAck(json.get("job_id").asText(), status);
    }

    private ObjectNode buildBody(RetrainingRequest r) {
        ObjectNode node = mapper.createObjectNode();
        node.put("model_id",      r.modelId());
        node.put("run_id",        r.runId().toString());
        node.put("max_statistic", r.maxStatistic());
        ArrayNode drifted = node.putArray("drifted_features");
        r.driftedFeatures().forEach(drifted::add);
        return node;
    }

    public record RetrainingRequest(String modelId, UUID runId, double maxStatistic, List<String> driftedFeatures) {
        public RetrainingRequest {
            driftedFeatures = List.copyOf(driftedFeatures);
        }
    }

    public record RetrainingAck(String jobId, String status) {}
}
