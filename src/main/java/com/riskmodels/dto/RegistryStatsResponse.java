package com.riskmodels.dto;

import com.riskmodels.entity.ModelStatus;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class RegistryStatsResponse {
    long totalModels;
    long totalVersions;
    long modelsInProduction;
    Map<ModelStatus, Long> versionsByStatus;
}
