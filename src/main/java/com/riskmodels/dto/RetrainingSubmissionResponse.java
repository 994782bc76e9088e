package com.riskmodels.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RetrainingSubmissionResponse {
    String modelName;
    boolean accepted;
    String message;
    TriggerDecision decision;
}
