package com.riskmodels.exception;

public class MlServiceUnavailableException extends ModelLifecycleException {
    public MlServiceUnavailableException(Throwable cause) {
        super("ML_SERVICE_UNAVAILABLE",
              "The ML training service is currently unavailable. Please try again later.",
              cause);
    }
}
