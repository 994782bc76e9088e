package com.riskmodels.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class RollbackRequest {
    /** Version to restore; when absent the previous production version is used. */
    String targetVersionId;
    @NotBlank
    @Size(max = 100)
    String actor;
    @NotBlank
    @Size(max = 1000)
    String reason;
}
