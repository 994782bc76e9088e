package com.riskmodels.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
public class ObservationRequest {
    @NotEmpty
    Map<String, Double> features;
}
