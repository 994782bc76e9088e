package com.riskmodels.exception;

public class TrainingFailedException extends ModelLifecycleException {
    public TrainingFailedException(String message) {
        super("TRAINING_FAILED", message);
    }
    public TrainingFailedException(String message, Throwable cause) {
        super("TRAINING_FAILED", message, cause);
    }
}
