package com.riskmodels.dto;

import com.riskmodels.entity.ModelStatus;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PromotionResult {
    String modelName;
    String versionId;
    PromotionDecision decision;
    ModelStatus resultingStatus;
    String replacedVersionId;
    /** {@code null} when there was no production baseline to compare against. */
    Double improvementPct;
    double thresholdPct;
}
