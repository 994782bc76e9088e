package com.riskmodels.service;

import com.riskmodels.dto.DeploymentRecordResponse;
import com.riskmodels.dto.MetricComparison;
import com.riskmodels.dto.ModelVersionResponse;
import com.riskmodels.dto.PromotionDecision;
import com.riskmodels.dto.PromotionResult;
import com.riskmodels.entity.ModelStatus;
import com.riskmodels.exception.InvalidRollbackException;
import com.riskmodels.exception.ModelNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Applies the promotion policy to evaluated candidates and carries out operator actions
 * (approval, rollback). Every status change goes through {@link ModelRegistryService}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Promoter {

    public static final double DEFAULT_IMPROVEMENT_THRESHOLD_PCT = 5.0;

    private final ModelRegistryService registry;
    private final NotificationService notifications;

    @Value("${lifecycle.promotion.improvement-threshold-pct:" + DEFAULT_IMPROVEMENT_THRESHOLD_PCT + "}")
    private double improvementThresholdPct = DEFAULT_IMPROVEMENT_THRESHOLD_PCT;

    @Value("${lifecycle.promotion.archive-rejected:false}")
    private boolean archiveRejected;

    @Value("${lifecycle.promotion.rollback-lookback:200}")
    private int rollbackLookback = 200;

    /**
     * Promotion policy for a freshly registered candidate.
     *
     * @param comparison candidate vs production on the primary metric, or {@code null} when
     *                   there is no production baseline
     */
    public PromotionResult decide(String modelName, String candidateVersionId, MetricComparison comparison,
                                  String actor) {
        Double improvement = comparison != null ? comparison.getImprovementPct() : null;
        PromotionResult.PromotionResultBuilder result = PromotionResult.builder()
            .modelName(modelName)
            .versionId(candidateVersionId)
            .improvementPct(improvement)
            .thresholdPct(improvementThresholdPct);

        if (improvement == null || improvement >= improvementThresholdPct) {
            String reason = improvement == null
                ? "No production baseline"
                : String.format(Locale.ROOT, "%s improved %.2f%% (threshold %.2f%%)",
                                comparison.getMetric(), improvement, improvementThresholdPct);
            DeploymentRecordResponse record = registry.setStatus(
                modelName, candidateVersionId, ModelStatus.PRODUCTION, actor, reason);
            notifications.modelPromoted(record, improvement);
            log.info("Promotion decision | model={} | version={} | decision=PROMOTED | improvementPct={}",
                     modelName, candidateVersionId, improvement);
            return result.decision(PromotionDecision.PROMOTED)
                .resultingStatus(ModelStatus.PRODUCTION)
                .replacedVersionId(record.getReplacedVersionId())
                .build();
        }

        if (improvement >= 0.0) {
            registry.setStatus(modelName, candidateVersionId, ModelStatus.STAGING, actor,
                String.format(Locale.ROOT, "%s improved %.2f%%, below %.2f%%; awaiting review",
                              comparison.getMetric(), improvement, improvementThresholdPct));
            log.info("Promotion decision | model={} | version={} | decision=HELD_FOR_REVIEW | improvementPct={}",
                     modelName, candidateVersionId, improvement);
            return result.decision(PromotionDecision.HELD_FOR_REVIEW)
                .resultingStatus(ModelStatus.STAGING)
                .build();
        }

        ModelStatus resulting = ModelStatus.REGISTERED;
        if (archiveRejected) {
            registry.setStatus(modelName, candidateVersionId, ModelStatus.ARCHIVED, actor,
                String.format(Locale.ROOT, "%s regressed %.2f%%", comparison.getMetric(), improvement));
            resulting = ModelStatus.ARCHIVED;
        }
        log.info("Promotion decision | model={} | version={} | decision=REJECTED | improvementPct={} | status={}",
                 modelName, candidateVersionId, improvement, resulting);
        return result.decision(PromotionDecision.REJECTED)
            .resultingStatus(resulting)
            .build();
    }

    /**
     * Restores a previous version. With no target, the most recent former production
     * version that is still ARCHIVED is chosen from the deployment history.
     */
    public DeploymentRecordResponse rollback(String modelName, String targetVersionId, String actor, String reason) {
        String target = targetVersionId != null && !targetVersionId.isBlank()
            ? targetVersionId
            : previousProduction(modelName);
        DeploymentRecordResponse record = registry.rollback(modelName, target, actor, reason);
        notifications.modelRolledBack(record);
        return record;
    }

    /** Human approval of a candidate held for review. */
    public DeploymentRecordResponse approve(String modelName, String versionId, String actor, String reason) {
        DeploymentRecordResponse record = registry.setStatus(modelName, versionId, ModelStatus.PRODUCTION, actor,
            reason != null && !reason.isBlank() ? reason : "Approved by " + actor);
        notifications.modelPromoted(record, null);
        log.info("Candidate approved | model={} | version={} | actor={}", modelName, versionId, actor);
        return record;
    }

    /**
     * Makes an A/B test winner the production version. Empty when the winner already is
     * production; a retired winner is restored through a rollback.
     */
    public Optional<DeploymentRecordResponse> promoteWinner(String modelName, String versionId, String actor,
                                                            String testId) {
        ModelVersionResponse winner = registry.get(modelName, versionId);
        String reason = "Winner of A/B test " + testId;
        DeploymentRecordResponse record;
        switch (winner.getStatus()) {
            case PRODUCTION -> {
                log.info("A/B winner already in production | model={} | version={} | test={}",
                         modelName, versionId, testId);
                return Optional.empty();
            }
            case ARCHIVED, ROLLED_BACK -> record = registry.rollback(modelName, versionId, actor, reason);
            default -> record = registry.setStatus(modelName, versionId, ModelStatus.PRODUCTION, actor, reason);
        }
        notifications.modelPromoted(record, null);
        return Optional.of(record);
    }

    public List<ModelVersionResponse> pendingReview(String modelName) {
        return registry.listVersions(modelName, ModelStatus.STAGING);
    }

    private String previousProduction(String modelName) {
        String current = null;
        try {
            current = registry.getProduction(modelName).getVersionId();
        } catch (ModelNotFoundException ex) {
            log.debug("No current production while resolving rollback target | model={}", modelName);
        }
        for (DeploymentRecordResponse record : registry.getDeploymentHistory(modelName, rollbackLookback)) {
            if (record.getNewStatus() != ModelStatus.PRODUCTION || record.getVersionId().equals(current)) {
                continue;
            }
            ModelVersionResponse candidate = registry.get(modelName, record.getVersionId());
            if (candidate.getStatus() == ModelStatus.ARCHIVED) {
                return candidate.getVersionId();
            }
        }
        throw new InvalidRollbackException("Model '" + modelName + "' has no previous production version to restore.");
    }
}
