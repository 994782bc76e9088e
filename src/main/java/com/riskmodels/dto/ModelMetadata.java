package com.riskmodels.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Everything the registry stores about a trained artifact apart from the artifact bytes.
 * {@code referenceSample} is the training-time feature sample later used for drift checks.
 */
@Value
@Builder
public class ModelMetadata {
    String datasetRef;
    Instant datasetSnapshotAt;
    @Singular
    Map<String, String> hyperparameters;
    @Singular("feature")
    List<String> featureSchema;
    @Singular
    Map<String, Double> metrics;
    Long trainingSampleCount;
    Map<String, List<Double>> referenceSample;
    String registeredBy;
}
