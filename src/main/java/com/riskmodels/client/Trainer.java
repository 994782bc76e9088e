package com.riskmodels.client;

import java.util.Map;

/**
 * Fits a model on a dataset snapshot. Implementations throw
 * {@link com.riskmodels.exception.TrainingFailedException} when training does not produce a model.
 */
public interface Trainer {

    TrainingResult train(String modelName, String datasetRef, Map<String, String> hyperparameters);
}
