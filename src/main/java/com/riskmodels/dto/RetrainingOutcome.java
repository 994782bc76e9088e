package com.riskmodels.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@Value
@Builder(toBuilder = true)
public class RetrainingOutcome {
    UUID runId;
    String modelName;
    Set<TriggerReason> triggers;
    RetrainingStatus status;
    String versionId;
    String productionVersionId;
    Map<String, Double> candidateMetrics;
    Map<String, Double> productionMetrics;
    PromotionResult promotion;
    String error;
    String errorCode;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant startedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant finishedAt;
}
