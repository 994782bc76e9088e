package com.riskmodels.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Signals gathered for one trigger evaluation. A {@code null} drift result means the drift
 * check produced no verdict; a {@code null} record count means the count was unavailable.
 */
@Value
@Builder
public class TriggerInputs {
    String modelName;
    DriftCheckResult drift;
    Long newRecordCount;
    Instant lastTrainedAt;
    boolean force;
    Instant now;
    String requestedBy;
}
