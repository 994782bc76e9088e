package com.riskmodels.dto;

import java.util.Map;

/**
 * Optional replacements for the dataset reference and hyperparameters a retraining run
 * would otherwise take from configuration and the current production version.
 */
public record TrainingOverrides(String datasetRef, Map<String, String> hyperparameters) {

    public static final TrainingOverrides NONE = new TrainingOverrides(null, null);
}
