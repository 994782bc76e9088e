package com.riskmodels.exception;

public class NoBaselineException extends ModelLifecycleException {
    public NoBaselineException(String message) {
        super("NO_BASELINE", message);
    }
}
