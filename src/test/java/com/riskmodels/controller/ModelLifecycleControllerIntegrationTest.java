package com.riskmodels.controller;

import com.riskmodels.dto.ModelMetadata;
import com.riskmodels.entity.ModelStatus;
import com.riskmodels.service.ModelRegistryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class ModelLifecycleControllerIntegrationTest {

    @Autowired TestRestTemplate restTemplate;
    @Autowired ModelRegistryService registry;

    private static String uniqueModel() {
        return "fraud-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private String register(String model, double rocAuc) {
        return registry.register(model, "bytes".getBytes(StandardCharsets.UTF_8),
            ModelMetadata.builder().datasetRef("tx-2025-02").metric("roc_auc", rocAuc).build());
    }

    private HttpEntity<Map<String, Object>> json(Map<String, Object> body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }

    @Test
    void production_unknownModel_returns404WithErrorCode() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/models/{m}/production", Map.class, uniqueModel());

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(resp.getBody()).containsEntry("errorCode", "NOT_FOUND");
        assertThat(resp.getBody()).containsKey("requestId");
    }

    @Test
    void requestId_isEchoed() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Request-ID", "trace-42");

        ResponseEntity<List> resp = restTemplate.exchange("/api/v1/models", HttpMethod.GET,
            new HttpEntity<>(headers), List.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getHeaders().getFirst("X-Request-ID")).isEqualTo("trace-42");
    }

    @Test
    void setStatus_promotesAndShowsInHistory() {
        String model = uniqueModel();
        String v = register(model, 0.9);

        ResponseEntity<Map> resp = restTemplate.exchange("/api/v1/models/{m}/versions/{v}/status", HttpMethod.PUT,
            json(Map.of("status", "PRODUCTION", "actor", "alice", "reason", "launch")), Map.class, model, v);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody()).containsEntry("newStatus", "PRODUCTION");
        ResponseEntity<List> history = restTemplate.getForEntity("/api/v1/models/{m}/deployments", List.class, model);
        assertThat(history.getBody()).hasSize(1);
        assertThat(registry.getProduction(model).getStatus()).isEqualTo(ModelStatus.PRODUCTION);
    }

    @Test
    void setStatus_missingActor_returns422() {
        String model = uniqueModel();
        String v = register(model, 0.9);

        ResponseEntity<Map> resp = restTemplate.exchange("/api/v1/models/{m}/versions/{v}/status", HttpMethod.PUT,
            json(Map.of("status", "STAGING")), Map.class, model, v);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody()).containsKey("fieldErrors");
    }

    @Test
    void rollback_toMissingVersion_returns404() {
        String model = uniqueModel();
        register(model, 0.9);

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/models/{m}/rollback",
            json(Map.of("targetVersionId", "v19990101000000_00000000", "actor", "oncall", "reason", "incident")),
            Map.class, model);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void abTest_weightsNotSummingToOne_returns422() {
        String model = uniqueModel();
        String a = register(model, 0.8);
        String b = register(model, 0.82);

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/ab-tests", json(Map.of(
            "modelName", model,
            "strategy", "AB",
            "variants", List.of(Map.of("versionId", a, "weight", 0.5), Map.of("versionId", b, "weight", 0.3)))),
            Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @Test
    void abTest_createThenRoute_isDeterministic() {
        String model = uniqueModel();
        String a = register(model, 0.8);
        String b = register(model, 0.82);

        ResponseEntity<Map> created = restTemplate.postForEntity("/api/v1/ab-tests", json(Map.of(
            "modelName", model,
            "strategy", "AB",
            "variants", List.of(Map.of("versionId", a, "weight", 0.5), Map.of("versionId", b, "weight", 0.5)))),
            Map.class);
        assertThat(created.getStatusCode()).isEqualTo(HttpStatus.CREATED);

        Map first = restTemplate.getForObject("/api/v1/models/{m}/route?key={k}", Map.class, model, "customer-17");
        Map second = restTemplate.getForObject("/api/v1/models/{m}/route?key={k}", Map.class, model, "customer-17");
        assertThat(first.get("versionId")).isEqualTo(second.get("versionId")).isIn(a, b);
    }

    @Test
    void observations_recordThenReset() {
        String model = uniqueModel();

        ResponseEntity<Void> recorded = restTemplate.postForEntity("/api/v1/models/{m}/observations",
            json(Map.of("features", Map.of("income", 52000.0))), Void.class, model);
        ResponseEntity<Void> reset = restTemplate.exchange("/api/v1/models/{m}/observations", HttpMethod.DELETE,
            HttpEntity.EMPTY, Void.class, model);

        assertThat(recorded.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(reset.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
    }
}
