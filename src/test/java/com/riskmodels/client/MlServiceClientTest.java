package com.riskmodels.client;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.riskmodels.dto.ModelVersionResponse;
import com.riskmodels.exception.MlServiceException;
import com.riskmodels.exception.MlServiceUnavailableException;
import com.riskmodels.exception.TrainingFailedException;
import org.junit.jupiter.api.*;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.*;

class MlServiceClientTest {

    private static WireMockServer wireMock;

    private MlServiceClient client;

    @BeforeAll
    static void startWireMock() {
        wireMock = new WireMockServer(WireMockConfiguration.wireMockConfig().dynamicPort());
        wireMock.start();
    }

    @AfterAll
    static void stopWireMock() { wireMock.stop(); }

    @BeforeEach
    void setUp() {
        wireMock.resetAll();
        client = new MlServiceClient();
        ReflectionTestUtils.setField(client, "baseUrl", "http://localhost:" + wireMock.port());
        ReflectionTestUtils.setField(client, "timeoutSeconds", 5);
        ReflectionTestUtils.setField(client, "trainingTimeout", Duration.ofSeconds(5));
        client.init();
    }

    private ModelVersionResponse version() {
        return ModelVersionResponse.builder()
            .modelName("credit-risk").versionId("v20250101000000_abcd1234")
            .artifactLocation("0b1c2d3e-0000-0000-0000-000000000000.bin").build();
    }

    private EvalDataset dataset(int n) {
        List<Integer> labels = new ArrayList<>();
        List<Map<String, Double>> rows = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            labels.add(i % 2);
            rows.add(Map.of("income", 1000.0 * i));
        }
        return new EvalDataset("holdout-1", labels, rows);
    }

    @Test
    void train_parsesArtifactMetricsAndReferenceSample() {
        String artifact = Base64.getEncoder().encodeToString("model-bytes".getBytes(StandardCharsets.UTF_8));
        wireMock.stubFor(post(urlEqualTo("/train")).willReturn(aResponse()
            .withHeader("Content-Type", "application/json")
            .withBody("{\"artifact\": \"" + artifact + "\", \"metrics\": {\"roc_auc\": 0.91},"
                + " \"dataset_ref\": \"loans-2025-01\", \"dataset_snapshot_at\": \"2025-01-31T00:00:00Z\","
                + " \"feature_schema\": [\"income\", \"age\"], \"n_training_samples\": 12000,"
                + " \"hyperparameters\": {\"max_depth\": \"6\"},"
                + " \"reference_sample\": {\"income\": [1.0, 2.0, 3.0]}}")));

        TrainingResult result = client.train("credit-risk", "latest", Map.of("max_depth", "6"));

        assertThat(new String(result.artifact(), StandardCharsets.UTF_8)).isEqualTo("model-bytes");
        assertThat(result.trainingMetrics()).containsEntry("roc_auc", 0.91);
        assertThat(result.datasetRef()).isEqualTo("loans-2025-01");
        assertThat(result.datasetSnapshotAt()).isEqualTo(Instant.parse("2025-01-31T00:00:00Z"));
        assertThat(result.featureSchema()).containsExactly("income", "age");
        assertThat(result.trainingSampleCount()).isEqualTo(12000);
        assertThat(result.referenceSample().get("income")).containsExactly(1.0, 2.0, 3.0);
        wireMock.verify(postRequestedFor(urlEqualTo("/train"))
            .withRequestBody(matchingJsonPath("$.model_name", equalTo("credit-risk")))
            .withRequestBody(matchingJsonPath("$.hyperparameters.max_depth", equalTo("6"))));
    }

    @Test
    void train_errorStatus_throwsTrainingFailed() {
        wireMock.stubFor(post(urlEqualTo("/train")).willReturn(aResponse().withStatus(500).withBody("boom")));

        assertThatThrownBy(() -> client.train("credit-risk", "latest", Map.of()))
            .isInstanceOf(TrainingFailedException.class)
            .hasMessageContaining("500");
    }

    @Test
    void train_missingArtifact_throwsTrainingFailed() {
        wireMock.stubFor(post(urlEqualTo("/train")).willReturn(aResponse()
            .withHeader("Content-Type", "application/json").withBody("{\"metrics\": {}}")));

        assertThatThrownBy(() -> client.train("credit-risk", "latest", Map.of()))
            .isInstanceOf(TrainingFailedException.class)
            .hasMessageContaining("artifact");
    }

    @Test
    void score_returnsProbabilities() {
        wireMock.stubFor(post(urlEqualTo("/score")).willReturn(aResponse()
            .withHeader("Content-Type", "application/json")
            .withBody("{\"probabilities\": [0.1, 0.8, 0.35]}")));

        List<Double> scores = client.score(version(), dataset(3));

        assertThat(scores).containsExactly(0.1, 0.8, 0.35);
        wireMock.verify(postRequestedFor(urlEqualTo("/score"))
            .withRequestBody(matchingJsonPath("$.version_id", equalTo("v20250101000000_abcd1234"))));
    }

    @Test
    void score_sizeMismatch_throwsMlServiceException() {
        wireMock.stubFor(post(urlEqualTo("/score")).willReturn(aResponse()
            .withHeader("Content-Type", "application/json")
            .withBody("{\"probabilities\": [0.1]}")));

        assertThatThrownBy(() -> client.score(version(), dataset(3)))
            .isInstanceOf(MlServiceException.class)
            .hasMessageContaining("does not match");
    }

    @Test
    void score_serverError_throwsUnavailable() {
        wireMock.stubFor(post(urlEqualTo("/score")).willReturn(aResponse().withStatus(503)));

        assertThatThrownBy(() -> client.score(version(), dataset(2)))
            .isInstanceOf(MlServiceUnavailableException.class);
    }

    @Test
    void heldOutSet_parsesLabelsAndRows() {
        wireMock.stubFor(get(urlEqualTo("/datasets/credit-risk/held-out")).willReturn(aResponse()
            .withHeader("Content-Type", "application/json")
            .withBody("{\"dataset_ref\": \"holdout-7\", \"labels\": [0, 1],"
                + " \"rows\": [{\"income\": 10.0}, {\"income\": 20.0}]}")));

        EvalDataset data = client.getHeldOutSet("credit-risk");

        assertThat(data.datasetRef()).isEqualTo("holdout-7");
        assertThat(data.labels()).containsExactly(0, 1);
        assertThat(data.rows().get(1)).containsEntry("income", 20.0);
    }

    @Test
    void labeledCount_passesSinceAndReadsCount() {
        wireMock.stubFor(get(urlPathEqualTo("/datasets/credit-risk/labeled-count"))
            .withQueryParam("since", equalTo("2025-01-01T00:00:00Z"))
            .willReturn(aResponse().withHeader("Content-Type", "application/json").withBody("{\"count\": 1500}")));

        assertThat(client.countLabeledRecordsSince("credit-risk", Instant.parse("2025-01-01T00:00:00Z")))
            .isEqualTo(1500);
    }

    @Test
    void fetchHeldOutSet_clientError_emitsMlServiceException() {
        wireMock.stubFor(get(urlEqualTo("/datasets/unknown/held-out")).willReturn(aResponse()
            .withStatus(404).withBody("no such model")));

        StepVerifier.create(client.fetchHeldOutSet("unknown"))
            .expectErrorSatisfies(ex -> assertThat(ex)
                .isInstanceOf(MlServiceException.class)
                .hasMessageContaining("no such model"))
            .verify();
    }

    @Test
    void fetchLabeledCount_missingCount_emitsMlServiceException() {
        wireMock.stubFor(get(urlPathEqualTo("/datasets/credit-risk/labeled-count"))
            .willReturn(aResponse().withHeader("Content-Type", "application/json").withBody("{\"total\": 3}")));

        StepVerifier.create(client.fetchLabeledCount("credit-risk", Instant.parse("2025-01-01T00:00:00Z")))
            .expectErrorMessage("Labeled-count response missing 'count': {\"total\":3}")
            .verify();
    }

    @Test
    void fetchLabeledCount_emitsCount() {
        wireMock.stubFor(get(urlPathEqualTo("/datasets/credit-risk/labeled-count"))
            .willReturn(aResponse().withHeader("Content-Type", "application/json").withBody("{\"count\": 42}")));

        StepVerifier.create(client.fetchLabeledCount("credit-risk", Instant.parse("2025-06-01T00:00:00Z")))
            .expectNext(42L)
            .verifyComplete();
    }
}
