package com.riskmodels.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class OutcomeRequest {
    @NotBlank
    String versionId;
    @NotNull
    Boolean success;
    Double metricValue;
}
