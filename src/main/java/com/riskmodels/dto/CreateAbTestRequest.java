package com.riskmodels.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * For rollout strategies the variants are {@code [baseline, candidate]} and their weights are
 * derived from the schedule; for {@link RolloutStrategy#AB} each variant carries its weight.
 */
@Value
@Builder
@Jacksonized
public class CreateAbTestRequest {
    @NotBlank
    String modelName;
    @NotNull
    RolloutStrategy strategy;
    @NotEmpty
    List<@Valid VariantWeight> variants;
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    Double canaryShare;
    List<Double> gradualSteps;
    @Min(1)
    Long stepIntervalMinutes;
    @Min(1)
    Integer minSamplesPerVariant;
    /** Planned length of the test; open-ended when absent. */
    @Min(1)
    Integer durationDays;
    String createdBy;
}
