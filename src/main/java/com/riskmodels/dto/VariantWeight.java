package com.riskmodels.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class VariantWeight {
    @NotBlank
    String versionId;
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    Double weight;
}
