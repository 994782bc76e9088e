package com.riskmodels.client;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record TrainingResult(
    byte[] artifact,
    Map<String, Double> trainingMetrics,
    String datasetRef,
    Instant datasetSnapshotAt,
    List<String> featureSchema,
    long trainingSampleCount,
    Map<String, String> hyperparameters,
    Map<String, List<Double>> referenceSample
) {
    public TrainingResult {
        trainingMetrics = trainingMetrics != null ? Map.copyOf(trainingMetrics) : Map.of();
        featureSchema = featureSchema != null ? List.copyOf(featureSchema) : List.of();
        hyperparameters = hyperparameters != null ? Map.copyOf(hyperparameters) : Map.of();
        referenceSample = referenceSample != null ? referenceSample : Map.of();
    }
}
