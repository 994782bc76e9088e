package com.riskmodels.exception;

public class MlServiceException extends ModelLifecycleException {
    public MlServiceException(String message) {
        super("ML_SERVICE_ERROR", message);
    }
    public MlServiceException(String message, Throwable cause) {
        super("ML_SERVICE_ERROR", message, cause);
    }
}
