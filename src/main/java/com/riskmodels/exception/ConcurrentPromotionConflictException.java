package com.riskmodels.exception;

public class ConcurrentPromotionConflictException extends ModelLifecycleException {
    public ConcurrentPromotionConflictException(String modelName, Throwable cause) {
        super("CONCURRENT_PROMOTION_CONFLICT",
              "Another status change for '" + modelName + "' is in progress; the operation was not applied.",
              cause);
    }
}
