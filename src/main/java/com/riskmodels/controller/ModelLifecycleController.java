package com.riskmodels.controller;

import com.riskmodels.dto.ApprovalRequest;
import com.riskmodels.dto.DeploymentRecordResponse;
import com.riskmodels.dto.DriftCheckResult;
import com.riskmodels.dto.DriftReport;
import com.riskmodels.dto.ModelVersionResponse;
import com.riskmodels.dto.ObservationRequest;
import com.riskmodels.dto.RegistryStatsResponse;
import com.riskmodels.dto.RetrainRequest;
import com.riskmodels.dto.RetrainingOutcome;
import com.riskmodels.dto.RetrainingSubmissionResponse;
import com.riskmodels.dto.RollbackRequest;
import com.riskmodels.dto.StatusChangeRequest;
import com.riskmodels.dto.VersionComparisonResponse;
import com.riskmodels.entity.ModelStatus;
import com.riskmodels.service.FeatureWindowService;
import com.riskmodels.service.ModelRegistryService;
import com.riskmodels.service.Promoter;
import com.riskmodels.service.RetrainingOrchestrator;
import com.riskmodels.service.RetrainingScheduler;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/models")
@RequiredArgsConstructor
public class ModelLifecycleController {

    private final ModelRegistryService registry;
    private final Promoter promoter;
    private final RetrainingScheduler retrainingScheduler;
    private final RetrainingOrchestrator orchestrator;
    private final FeatureWindowService featureWindows;

    @GetMapping
    public ResponseEntity<List<String>> models() {
        return ResponseEntity.ok(registry.listModelNames());
    }

    @GetMapping("/stats")
    public ResponseEntity<RegistryStatsResponse> statistics() {
        return ResponseEntity.ok(registry.statistics());
    }

    @GetMapping("/{modelName}/versions")
    public ResponseEntity<List<ModelVersionResponse>> versions(
            @PathVariable String modelName, @RequestParam(required = false) ModelStatus status) {
        return ResponseEntity.ok(registry.listVersions(modelName, status));
    }

    @GetMapping("/{modelName}/versions/{versionId}")
    public ResponseEntity<ModelVersionResponse> version(@PathVariable String modelName, @PathVariable String versionId) {
        return ResponseEntity.ok(registry.get(modelName, versionId));
    }

    @GetMapping("/{modelName}/production")
    public ResponseEntity<ModelVersionResponse> production(@PathVariable String modelName) {
        return ResponseEntity.ok(registry.getProduction(modelName));
    }

    @GetMapping("/{modelName}/compare")
    public ResponseEntity<List<VersionComparisonResponse>> compare(
            @PathVariable String modelName,
            @RequestParam(required = false) List<String> versionIds,
            @RequestParam(required = false) String metric) {
        return ResponseEntity.ok(registry.compareVersions(modelName, versionIds, metric));
    }

    @PutMapping("/{modelName}/versions/{versionId}/status")
    public ResponseEntity<DeploymentRecordResponse> setStatus(
            @PathVariable String modelName, @PathVariable String versionId,
            @Valid @RequestBody StatusChangeRequest request) {
        log.info("PUT /models/{}/versions/{}/status | status={} | actor={}",
                 modelName, versionId, request.getStatus(), request.getActor());
        return ResponseEntity.ok(registry.setStatus(
            modelName, versionId, request.getStatus(), request.getActor(), request.getReason()));
    }

    @PostMapping("/{modelName}/versions/{versionId}/approve")
    public ResponseEntity<DeploymentRecordResponse> approve(
            @PathVariable String modelName, @PathVariable String versionId,
            @Valid @RequestBody ApprovalRequest request) {
        log.info("POST /models/{}/versions/{}/approve | approvedBy={}", modelName, versionId, request.getApprovedBy());
        return ResponseEntity.ok(promoter.approve(modelName, versionId, request.getApprovedBy(), request.getReason()));
    }

    @GetMapping("/{modelName}/pending-review")
    public ResponseEntity<List<ModelVersionResponse>> pendingReview(@PathVariable String modelName) {
        return ResponseEntity.ok(promoter.pendingReview(modelName));
    }

    @PostMapping("/{modelName}/rollback")
    public ResponseEntity<DeploymentRecordResponse> rollback(
            @PathVariable String modelName, @Valid @RequestBody RollbackRequest request) {
        log.info("POST /models/{}/rollback | target={} | actor={}", modelName, request.getTargetVersionId(), request.getActor());
        return ResponseEntity.ok(promoter.rollback(
            modelName, request.getTargetVersionId(), request.getActor(), request.getReason()));
    }

    @GetMapping("/{modelName}/deployments")
    public ResponseEntity<List<DeploymentRecordResponse>> deployments(
            @PathVariable String modelName,
            @RequestParam(required = false) @Min(1) @Max(1000) Integer limit) {
        return ResponseEntity.ok(registry.getDeploymentHistory(modelName, limit));
    }

    @PostMapping("/{modelName}/retrain")
    public ResponseEntity<RetrainingSubmissionResponse> retrain(
            @PathVariable String modelName, @Valid @RequestBody(required = false) RetrainRequest request) {
        log.info("POST /models/{}/retrain | force={}", modelName, request != null && request.isForce());
        RetrainingSubmissionResponse response = retrainingScheduler.requestRetraining(modelName, request);
        return ResponseEntity.status(response.isAccepted() ? HttpStatus.ACCEPTED : HttpStatus.OK).body(response);
    }

    @GetMapping("/{modelName}/retraining")
    public ResponseEntity<Map<String, Object>> retrainingState(@PathVariable String modelName) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("modelName", modelName);
        body.put("running", orchestrator.isRunning(modelName));
        body.put("lastOutcome", orchestrator.lastOutcome(modelName).orElse(null));
        return ResponseEntity.ok(body);
    }

    @PostMapping("/{modelName}/drift-check")
    public ResponseEntity<DriftCheckResult> driftCheck(@PathVariable String modelName) {
        return ResponseEntity.ok(retrainingScheduler.checkDrift(modelName));
    }

    @GetMapping("/{modelName}/drift-reports")
    public ResponseEntity<List<DriftReport>> driftReports(
            @PathVariable String modelName,
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int limit) {
        return ResponseEntity.ok(retrainingScheduler.recentDriftReports(modelName, limit));
    }

    @PostMapping("/{modelName}/observations")
    public ResponseEntity<Void> observe(
            @PathVariable String modelName, @Valid @RequestBody ObservationRequest request) {
        featureWindows.observe(modelName, request.getFeatures());
        return ResponseEntity.accepted().build();
    }

    @DeleteMapping("/{modelName}/observations")
    public ResponseEntity<Void> resetObservations(@PathVariable String modelName) {
        log.info("DELETE /models/{}/observations", modelName);
        featureWindows.reset(modelName);
        return ResponseEntity.noContent().build();
    }
}
