package com.riskmodels.service;

import com.riskmodels.client.LabeledDataSource;
import com.riskmodels.dto.DriftCheckResult;
import com.riskmodels.dto.DriftReport;
import com.riskmodels.dto.ModelVersionResponse;
import com.riskmodels.dto.RetrainRequest;
import com.riskmodels.dto.RetrainingSubmissionResponse;
import com.riskmodels.dto.TrainingOverrides;
import com.riskmodels.dto.TriggerDecision;
import com.riskmodels.dto.TriggerInputs;
import com.riskmodels.entity.DriftReportRecord;
import com.riskmodels.exception.InsufficientDataException;
import com.riskmodels.exception.ModelNotFoundException;
import com.riskmodels.repository.DriftReportRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Periodic monitoring sweep: gathers retraining signals for every registered model,
 * evaluates the triggers and submits the decision. A failure on one signal or one model
 * never stops the sweep.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetrainingScheduler {

    public static final String SCHEDULER_ACTOR = "scheduler";

    private final ModelRegistryService registry;
    private final DriftDetector driftDetector;
    private final FeatureWindowService featureWindows;
    private final LabeledDataSource labeledDataSource;
    private final TriggerEvaluator triggerEvaluator;
    private final RetrainingOrchestrator orchestrator;
    private final NotificationService notifications;
    private final DriftReportRepository driftReportRepository;

    @Value("${lifecycle.retraining.enabled:true}")
    private boolean enabled = true;

    @Scheduled(cron = "${lifecycle.retraining.cron:0 0 2 1 * *}")
    public void runScheduledChecks() {
        if (!enabled) {
            log.debug("Scheduled retraining checks disabled");
            return;
        }
        List<String> models = registry.listModelNames();
        log.info("Scheduled retraining sweep started | models={}", models.size());
        int submitted = 0;
        for (String modelName : models) {
            try {
                if (evaluate(modelName, false, SCHEDULER_ACTOR, TrainingOverrides.NONE).isAccepted()) {
                    submitted++;
                }
            } catch (RuntimeException ex) {
                log.error("Scheduled check failed | model={} | reason={}", modelName, ex.getMessage(), ex);
            }
        }
        log.info("Scheduled retraining sweep finished | models={} | submitted={}", models.size(), submitted);
    }

    /** Operator-triggered evaluation; {@code force} fires the FORCED trigger. */
    public RetrainingSubmissionResponse requestRetraining(String modelName, RetrainRequest request) {
        RetrainRequest req = request != null ? request : RetrainRequest.builder().build();
        return evaluate(modelName, req.isForce(),
                        req.getRequestedBy() != null ? req.getRequestedBy() : "operator",
                        new TrainingOverrides(req.getDatasetRef(), req.getHyperparameters()));
    }

    /**
     * Drift of the live window against the production version's reference sample. The
     * per-feature reports are stored and a notification is sent when drift is found.
     */
    public DriftCheckResult checkDrift(String modelName) {
        ModelVersionResponse production = registry.getProduction(modelName);
        Map<String, double[]> reference = registry.loadReferenceSample(production);
        DriftCheckResult result = driftDetector
            .detect(modelName, reference, featureWindows.snapshot(modelName))
            .withReferenceVersion(production.getVersionId());
        persist(result);
        if (result.isDriftDetected()) {
            notifications.driftDetected(result);
        }
        return result;
    }

    public List<DriftReport> recentDriftReports(String modelName, int limit) {
        return driftReportRepository.findByModelNameOrderByCheckedAtDesc(modelName, PageRequest.of(0, Math.max(1, limit)))
            .stream()
            .map(r -> DriftReport.builder()
                .modelName(r.getModelName())
                .featureName(r.getFeatureName())
                .ksStatistic(r.getKsStatistic())
                .ksPValue(r.getKsPValue())
                .psi(r.getPsi())
                .significanceLevel(r.getSignificanceLevel())
                .psiThreshold(r.getPsiThreshold())
                .exceeded(r.isExceeded())
                .referenceSize(r.getReferenceSize())
                .recentSize(r.getRecentSize())
                .timestamp(r.getCheckedAt())
                .build())
            .toList();
    }

    private RetrainingSubmissionResponse evaluate(String modelName, boolean force, String requestedBy,
                                                  TrainingOverrides overrides) {
        Instant lastTrainedAt = lastTrainedAt(modelName);
        TriggerDecision decision = triggerEvaluator.evaluate(TriggerInputs.builder()
            .modelName(modelName)
            .drift(driftSignal(modelName))
            .newRecordCount(volumeSignal(modelName, lastTrainedAt))
            .lastTrainedAt(lastTrainedAt)
            .force(force)
            .now(Instant.now())
            .requestedBy(requestedBy)
            .build());

        if (!decision.shouldRetrain()) {
            return RetrainingSubmissionResponse.builder()
                .modelName(modelName)
                .accepted(false)
                .message("No retraining trigger fired.")
                .decision(decision)
                .build();
        }
        boolean accepted = orchestrator.submit(decision, overrides);
        return RetrainingSubmissionResponse.builder()
            .modelName(modelName)
            .accepted(accepted)
            .message(accepted ? "Retraining started." : "A retraining run is already in progress.")
            .decision(decision)
            .build();
    }

    private DriftCheckResult driftSignal(String modelName) {
        try {
            return checkDrift(modelName);
        } catch (InsufficientDataException ex) {
            log.info("No drift verdict | model={} | reason={}", modelName, ex.getMessage());
        } catch (ModelNotFoundException ex) {
            log.debug("No production version to check drift against | model={}", modelName);
        } catch (RuntimeException ex) {
            log.warn("Drift signal unavailable | model={} | reason={}", modelName, ex.getMessage());
        }
        return null;
    }

    private Long volumeSignal(String modelName, Instant lastTrainedAt) {
        try {
            return labeledDataSource.countLabeledRecordsSince(modelName,
                lastTrainedAt != null ? lastTrainedAt : Instant.EPOCH);
        } catch (RuntimeException ex) {
            log.warn("Volume signal unavailable | model={} | reason={}", modelName, ex.getMessage());
            return null;
        }
    }

    /** Snapshot time of the newest version's training data, or its creation time. */
    private Instant lastTrainedAt(String modelName) {
        return registry.listVersions(modelName, null).stream()
            .findFirst()
            .map(v -> v.getDatasetSnapshotAt() != null ? v.getDatasetSnapshotAt() : v.getCreatedAt())
            .orElse(null);
    }

    private void persist(DriftCheckResult result) {
        try {
            for (DriftReport r : result.getReports()) {
                driftReportRepository.save(DriftReportRecord.builder()
                    .modelName(result.getModelName())
                    .referenceVersionId(result.getReferenceVersionId())
                    .featureName(r.getFeatureName())
                    .ksStatistic(r.getKsStatistic())
                    .ksPValue(r.getKsPValue())
                    .psi(r.getPsi())
                    .significanceLevel(r.getSignificanceLevel())
                    .psiThreshold(r.getPsiThreshold())
                    .exceeded(r.isExceeded())
                    .referenceSize(r.getReferenceSize())
                    .recentSize(r.getRecentSize())
                    .checkedAt(r.getTimestamp())
                    .build());
            }
        } catch (RuntimeException ex) {
            log.warn("Drift reports not stored | model={} | reason={}", result.getModelName(), ex.getMessage());
        }
    }
}
