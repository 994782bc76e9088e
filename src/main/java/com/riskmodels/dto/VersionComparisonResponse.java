package com.riskmodels.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.riskmodels.entity.ModelStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class VersionComparisonResponse {
    int rank;
    String versionId;
    ModelStatus status;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
    String sortMetric;
    double sortValue;
    Map<String, Double> metrics;
    String datasetRef;
    Long trainingSampleCount;
}
