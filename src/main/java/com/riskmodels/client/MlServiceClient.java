package com.riskmodels.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.riskmodels.dto.ModelVersionResponse;
import com.riskmodels.exception.MlServiceException;
import com.riskmodels.exception.MlServiceUnavailableException;
import com.riskmodels.exception.TrainingFailedException;
import io.netty.channel.ChannelOption;
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
import reactor.util.retry.Retry;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * HTTP client for the ML service that owns training, scoring and the labeled datasets.
 */
@Slf4j
@Component
public class MlServiceClient implements Trainer, ModelScorer, EvalDatasetProvider, LabeledDataSource {

    @Value("${ml.service.base-url}")
    private String baseUrl;

    @Value("${ml.service.timeout-seconds:10}")
    private int timeoutSeconds;

    @Value("${ml.service.training-timeout:PT6H}")
    private Duration trainingTimeout;

    private WebClient webClient;
    private final ObjectMapper mapper = new ObjectMapper();

    @PostConstruct
    void init() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000);
        this.webClient = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(c -> c.defaultCodecs().maxInMemorySize(256 * 1024 * 1024))
            .defaultHeader("Content-Type", "application/json")
            .build();
        log.info("MlServiceClient initialised → {}", baseUrl);
    }

    @Override
    public TrainingResult train(String modelName, String datasetRef, Map<String, String> hyperparameters) {
        ObjectNode body = mapper.createObjectNode();
        body.put("model_name", modelName);
        body.put("dataset_ref", datasetRef);
        ObjectNode params = body.putObject("hyperparameters");
        if (hyperparameters != null) {
            hyperparameters.forEach(params::put);
        }

        log.info("Training requested | model={} | datasetRef={} | timeout={}", modelName, datasetRef, trainingTimeout);
        return webClient.post().uri("/train")
            .bodyValue(body)
            .retrieve()
            .onStatus(HttpStatusCode::isError, resp ->
                resp.bodyToMono(String.class).defaultIfEmpty("")
                    .map(b -> new TrainingFailedException(
                        "Trainer rejected '" + modelName + "' (" + resp.statusCode().value() + "): " + b)))
            .bodyToMono(JsonNode.class)
            .timeout(trainingTimeout)
            .map(json -> toTrainingResult(modelName, json))
            .onErrorMap(TimeoutException.class, ex ->
                new TrainingFailedException("Training of '" + modelName + "' exceeded " + trainingTimeout, ex))
            .onErrorMap(WebClientRequestException.class, ex ->
                new TrainingFailedException("Trainer unreachable for '" + modelName + "'", new MlServiceUnavailableException(ex)))
            .blockOptional()
            .orElseThrow(() -> new TrainingFailedException("Trainer returned an empty response for '" + modelName + "'"));
    }

    @Override
    public List<Double> score(ModelVersionResponse version, EvalDataset dataset) {
        ObjectNode body = mapper.createObjectNode();
        body.put("model_name", version.getModelName());
        body.put("version_id", version.getVersionId());
        body.put("artifact_location", version.getArtifactLocation());
        ArrayNode rows = body.putArray("rows");
        dataset.rows().forEach(row -> {
            ObjectNode node = rows.addObject();
            row.forEach(node::put);
        });

        List<Double> scores = webClient.post().uri("/score")
            .bodyValue(body)
            .retrieve()
            .onStatus(HttpStatusCode::is4xxClientError, resp ->
                resp.bodyToMono(String.class).defaultIfEmpty("").map(b -> new MlServiceException("ML service rejected scoring request (4xx): " + b)))
            .onStatus(HttpStatusCode::is5xxServerError, resp ->
                resp.bodyToMono(String.class).defaultIfEmpty("").map(b -> new MlServiceUnavailableException(new RuntimeException(b))))
            .bodyToMono(JsonNode.class)
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .map(json -> readDoubles(json, "probabilities"))
            .onErrorMap(WebClientRequestException.class, MlServiceUnavailableException::new)
            .blockOptional()
            .orElseThrow(() -> new MlServiceException("ML service returned an empty scoring response"));

        if (scores.size() != dataset.size()) {
            throw new MlServiceException("Scoring response size " + scores.size()
                + " does not match dataset size " + dataset.size());
        }
        return scores;
    }

    @Override
    public EvalDataset getHeldOutSet(String modelName) {
        return fetchHeldOutSet(modelName)
            .blockOptional()
            .orElseThrow(() -> new MlServiceException("ML service returned no held-out set for '" + modelName + "'"));
    }

    public Mono<EvalDataset> fetchHeldOutSet(String modelName) {
        return get("/datasets/{model}/held-out", modelName)
            .map(this::toEvalDataset);
    }

    @Override
    public long countLabeledRecordsSince(String modelName, Instant since) {
        return fetchLabeledCount(modelName, since)
            .blockOptional()
            .orElse(0L);
    }

    public Mono<Long> fetchLabeledCount(String modelName, Instant since) {
        return webClient.get()
            .uri(b -> b.path("/datasets/{model}/labeled-count")
                .queryParam("since", since.toString())
                .build(modelName))
            .retrieve()
            .onStatus(HttpStatusCode::isError, resp ->
                resp.bodyToMono(String.class).defaultIfEmpty("")
                    .map(b -> new MlServiceException("Labeled-count lookup failed: " + b)))
            .bodyToMono(JsonNode.class)
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .retryWhen(Retry.backoff(2, Duration.ofMillis(300))
                .filter(ex -> ex instanceof WebClientRequestException)
                .onRetryExhaustedThrow((spec, sig) -> new MlServiceUnavailableException(sig.failure())))
            .map(json -> {
                if (json == null || !json.hasNonNull("count")) {
                    throw new MlServiceException("Labeled-count response missing 'count': " + json);
                }
                return json.get("count").asLong();
            });
    }

    private Mono<JsonNode> get(String uri, Object... vars) {
        return webClient.get().uri(uri, vars)
            .retrieve()
            .onStatus(HttpStatusCode::is4xxClientError, resp ->
                resp.bodyToMono(String.class).defaultIfEmpty("").map(b -> new MlServiceException("ML service rejected request (4xx): " + b)))
            .onStatus(HttpStatusCode::is5xxServerError, resp ->
                resp.bodyToMono(String.class).defaultIfEmpty("").map(b -> new MlServiceUnavailableException(new RuntimeException(b))))
            .bodyToMono(JsonNode.class)
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .retryWhen(Retry.backoff(2, Duration.ofMillis(300))
                .filter(ex -> ex instanceof WebClientRequestException)
                .onRetryExhaustedThrow((spec, sig) -> new MlServiceUnavailableException(sig.failure())));
    }

    private TrainingResult toTrainingResult(String modelName, JsonNode json) {
        if (json == null || !json.hasNonNull("artifact")) {
            throw new TrainingFailedException("Trainer response for '" + modelName + "' is missing 'artifact'");
        }
        byte[] artifact;
        try {
            artifact = Base64.getDecoder().decode(json.get("artifact").asText());
        } catch (IllegalArgumentException ex) {
            throw new TrainingFailedException("Trainer returned a malformed artifact for '" + modelName + "'", ex);
        }
        String snapshot = json.path("dataset_snapshot_at").asText(null);
        return new TrainingResult(
            artifact,
            readDoubleMap(json.get("metrics")),
            json.path("dataset_ref").asText(null),
            snapshot != null ? Instant.parse(snapshot) : null,
            readStrings(json.get("feature_schema")),
            json.path("n_training_samples").asLong(0),
            readStringMap(json.get("hyperparameters")),
            readSample(json.get("reference_sample")));
    }

    private EvalDataset toEvalDataset(JsonNode json) {
        if (json == null || !json.has("labels") || !json.has("rows")) {
            throw new MlServiceException("Held-out set response missing 'labels' or 'rows'");
        }
        List<Integer> labels = new ArrayList<>();
        json.get("labels").forEach(n -> labels.add(n.asInt()));
        List<Map<String, Double>> rows = new ArrayList<>();
        json.get("rows").forEach(n -> rows.add(readDoubleMap(n)));
        return new EvalDataset(json.path("dataset_ref").asText(null), labels, rows);
    }

    private List<Double> readDoubles(JsonNode json, String key) {
        JsonNode node = json != null ? json.get(key) : null;
        if (node == null || !node.isArray()) {
            throw new MlServiceException("ML service response missing '" + key + "': " + json);
        }
        List<Double> values = new ArrayList<>(node.size());
        node.forEach(n -> values.add(n.asDouble()));
        return values;
    }

    private Map<String, Double> readDoubleMap(JsonNode node) {
        Map<String, Double> values = new LinkedHashMap<>();
        if (node != null) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> e = fields.next();
                if (e.getValue().isNumber()) {
                    values.put(e.getKey(), e.getValue().asDouble());
                }
            }
        }
        return values;
    }

    private Map<String, String> readStringMap(JsonNode node) {
        Map<String, String> values = new LinkedHashMap<>();
        if (node != null) {
            node.fields().forEachRemaining(e -> values.put(e.getKey(), e.getValue().asText()));
        }
        return values;
    }

    private List<String> readStrings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null) {
            node.forEach(n -> values.add(n.asText()));
        }
        return values;
    }

    private Map<String, List<Double>> readSample(JsonNode node) {
        Map<String, List<Double>> sample = new LinkedHashMap<>();
        if (node != null) {
            node.fields().forEachRemaining(e -> {
                List<Double> values = new ArrayList<>(e.getValue().size());
                e.getValue().forEach(v -> values.add(v.asDouble()));
                sample.put(e.getKey(), values);
            });
        }
        return sample;
    }
}
