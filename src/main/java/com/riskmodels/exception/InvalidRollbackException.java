package com.riskmodels.exception;

public class InvalidRollbackException extends ModelLifecycleException {
    public InvalidRollbackException(String message) {
        super("INVALID_ROLLBACK", message);
    }
}
