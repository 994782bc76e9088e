package com.riskmodels.dto;

import com.riskmodels.entity.ModelStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class StatusChangeRequest {
    @NotNull
    ModelStatus status;
    @NotBlank
    @Size(max = 100)
    String actor;
    @Size(max = 1000)
    String reason;
}
