package com.riskmodels.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ApprovalRequest {
    @NotBlank
    @Size(max = 100)
    String approvedBy;
    @Size(max = 1000)
    String reason;
}
