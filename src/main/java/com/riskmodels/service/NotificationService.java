package com.riskmodels.service;

import com.riskmodels.client.NotificationTransport;
import com.riskmodels.dto.AbTestResponse;
import com.riskmodels.dto.DeploymentRecordResponse;
import com.riskmodels.dto.DriftCheckResult;
import com.riskmodels.dto.DriftReport;
import com.riskmodels.dto.NotificationMessage;
import com.riskmodels.dto.NotificationType;
import com.riskmodels.dto.PromotionResult;
import com.riskmodels.dto.RetrainingOutcome;
import com.riskmodels.dto.TriggerDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Formats lifecycle events into human-readable messages and hands them to the transport.
 * Delivery is best effort: a transport failure is logged and never reaches the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final NotificationTransport transport;

    public void retrainingStarted(TriggerDecision decision, UUID runId) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("runId", runId.toString());
        attrs.put("triggers", decision.getReasons());
        attrs.put("newRecordCount", decision.getNewRecordCount());
        dispatch(NotificationType.RETRAINING_STARTED, decision.getModelName(),
                 "Retraining started for " + decision.getModelName(),
                 "Run " + runId + " triggered by " + decision.getReasons() + ".",
                 attrs);
    }

    public void retrainingCompleted(RetrainingOutcome outcome) {
        PromotionResult promotion = outcome.getPromotion();
        StringBuilder body = new StringBuilder()
            .append("New version: ").append(outcome.getVersionId()).append('\n')
            .append("Triggers: ").append(outcome.getTriggers()).append('\n')
            .append("Production version: ").append(orNone(outcome.getProductionVersionId())).append('\n');
        appendMetrics(body, "Production metrics", outcome.getProductionMetrics());
        appendMetrics(body, "Candidate metrics", outcome.getCandidateMetrics());
        if (promotion != null) {
            body.append("Decision: ").append(promotion.getDecision())
                .append(" -> ").append(promotion.getResultingStatus());
            if (promotion.getImprovementPct() != null) {
                body.append(String.format(Locale.ROOT, " (improvement %.2f%%, threshold %.2f%%)",
                                          promotion.getImprovementPct(), promotion.getThresholdPct()));
            } else {
                body.append(" (no production baseline)");
            }
        }

        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("runId", String.valueOf(outcome.getRunId()));
        attrs.put("versionId", outcome.getVersionId());
        if (promotion != null) {
            attrs.put("decision", promotion.getDecision());
            attrs.put("status", promotion.getResultingStatus());
            attrs.put("improvementPct", promotion.getImprovementPct());
        }
        dispatch(NotificationType.RETRAINING_COMPLETED, outcome.getModelName(),
                 "Retraining completed for " + outcome.getModelName(), body.toString(), attrs);
    }

    public void retrainingFailed(RetrainingOutcome outcome) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("runId", String.valueOf(outcome.getRunId()));
        attrs.put("errorCode", outcome.getErrorCode());
        attrs.put("versionId", outcome.getVersionId());
        String body = "Triggers: " + outcome.getTriggers() + "\n"
            + (outcome.getVersionId() != null ? "Registered version: " + outcome.getVersionId() + "\n" : "")
            + "Error: " + outcome.getError();
        dispatch(NotificationType.RETRAINING_FAILED, outcome.getModelName(),
                 "Retraining FAILED for " + outcome.getModelName(), body, attrs);
    }

    public void driftDetected(DriftCheckResult result) {
        StringBuilder body = new StringBuilder("Reference version: ")
            .append(orNone(result.getReferenceVersionId())).append('\n');
        for (DriftReport r : result.driftedFeatures()) {
            body.append(String.format(Locale.ROOT, "- %s: KS=%.4f (p=%.4f, alpha=%.2f), PSI=%.4f (threshold %.2f)%n",
                                      r.getFeatureName(), r.getKsStatistic(), r.getKsPValue(),
                                      r.getSignificanceLevel(), r.getPsi(), r.getPsiThreshold()));
        }
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("features", result.driftedFeatures().stream().map(DriftReport::getFeatureName).toList());
        attrs.put("referenceVersionId", result.getReferenceVersionId());
        dispatch(NotificationType.DRIFT_DETECTED, result.getModelName(),
                 "Data drift detected for " + result.getModelName(), body.toString().stripTrailing(), attrs);
    }

    public void modelPromoted(DeploymentRecordResponse record, Double improvementPct) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("versionId", record.getVersionId());
        attrs.put("replacedVersionId", record.getReplacedVersionId());
        attrs.put("actor", record.getActor());
        attrs.put("improvementPct", improvementPct);
        String body = "Version " + record.getVersionId() + " is now PRODUCTION"
            + (record.getReplacedVersionId() != null ? ", replacing " + record.getReplacedVersionId() : "")
            + ".\nActor: " + record.getActor()
            + (improvementPct != null ? String.format(Locale.ROOT, "%nImprovement: %.2f%%", improvementPct) : "")
            + (record.getReason() != null ? "\nReason: " + record.getReason() : "");
        dispatch(NotificationType.MODEL_PROMOTED, record.getModelName(),
                 "Model promoted: " + record.getModelName(), body, attrs);
    }

    public void modelRolledBack(DeploymentRecordResponse record) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("versionId", record.getVersionId());
        attrs.put("replacedVersionId", record.getReplacedVersionId());
        attrs.put("actor", record.getActor());
        attrs.put("reason", record.getReason());
        String body = "Restored version " + record.getVersionId()
            + " (replaced " + orNone(record.getReplacedVersionId()) + ").\n"
            + "Actor: " + record.getActor() + "\n"
            + "Reason: " + record.getReason();
        dispatch(NotificationType.MODEL_ROLLED_BACK, record.getModelName(),
                 "Model rolled back: " + record.getModelName(), body, attrs);
    }

    public void abTestCompleted(AbTestResponse test) {
        StringBuilder body = new StringBuilder("Strategy: ").append(test.getStrategy()).append('\n')
            .append("Winner: ").append(test.getWinnerVersionId()).append('\n');
        for (AbTestResponse.VariantStats v : test.getVariants()) {
            body.append("- ").append(v.getVersionId())
                .append(": requests=").append(v.getRequests())
                .append(", successRate=").append(v.getSuccessRate())
                .append(", meanMetric=").append(v.getMeanMetric()).append('\n');
        }
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("testId", test.getTestId());
        attrs.put("winnerVersionId", test.getWinnerVersionId());
        dispatch(NotificationType.AB_TEST_COMPLETED, test.getModelName(),
                 "A/B test completed for " + test.getModelName(), body.toString().stripTrailing(), attrs);
    }

    private void dispatch(NotificationType type, String modelName, String subject, String body,
                          Map<String, Object> attributes) {
        NotificationMessage message = NotificationMessage.builder()
            .type(type)
            .modelName(modelName)
            .subject(subject)
            .body(body)
            .attributes(attributes)
            .createdAt(Instant.now())
            .build();
        try {
            transport.send(message);
            log.debug("Notification sent | type={} | model={}", type, modelName);
        } catch (RuntimeException ex) {
            log.error("Notification delivery failed | type={} | model={} | reason={}",
                      type, modelName, ex.getMessage(), ex);
        }
    }

    private static void appendMetrics(StringBuilder body, String label, Map<String, Double> metrics) {
        body.append(label).append(": ");
        if (metrics == null || metrics.isEmpty()) {
            body.append("none\n");
            return;
        }
        StringBuilder line = new StringBuilder();
        for (String key : new TreeSet<>(metrics.keySet())) {
            if (line.length() > 0) {
                line.append(", ");
            }
            line.append(key).append('=').append(String.format(Locale.ROOT, "%.4f", metrics.get(key)));
        }
        body.append(line).append('\n');
    }

    private static String orNone(String value) {
        return value != null ? value : "none";
    }
}
