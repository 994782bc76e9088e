package com.riskmodels.exception;

public class ModelNotFoundException extends ModelLifecycleException {
    public ModelNotFoundException(String message) {
        super("NOT_FOUND", message);
    }

    public static ModelNotFoundException version(String modelName, String versionId) {
        return new ModelNotFoundException(
            "Model version '" + versionId + "' of '" + modelName + "' not found.");
    }

    public static ModelNotFoundException production(String modelName) {
        return new ModelNotFoundException("Model '" + modelName + "' has no PRODUCTION version.");
    }
}
