package com.riskmodels.exception;

public class InvalidAbTestException extends ModelLifecycleException {
    public InvalidAbTestException(String message) {
        super("INVALID_AB_TEST", message);
    }
}
