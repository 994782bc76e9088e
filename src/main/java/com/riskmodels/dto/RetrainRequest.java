package com.riskmodels.dto;

import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
public class RetrainRequest {
    boolean force;
    @Size(max = 255)
    String datasetRef;
    Map<String, String> hyperparameters;
    @Size(max = 100)
    String requestedBy;
}
