package com.riskmodels.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.riskmodels.entity.ModelStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class ModelVersionResponse {
    String modelName;
    String versionId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
    String datasetRef;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant datasetSnapshotAt;
    Map<String, String> hyperparameters;
    List<String> featureSchema;
    Map<String, Double> metrics;
    Long trainingSampleCount;
    String artifactLocation;
    String referenceSampleLocation;
    ModelStatus status;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant deployedAt;
    String registeredBy;

    public Double metric(String name) {
        return metrics != null ? metrics.get(name) : null;
    }
}
