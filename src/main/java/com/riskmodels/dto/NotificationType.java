package com.riskmodels.dto;

public enum NotificationType {
    RETRAINING_STARTED,
    RETRAINING_COMPLETED,
    RETRAINING_FAILED,
    DRIFT_DETECTED,
    MODEL_PROMOTED,
    MODEL_ROLLED_BACK,
    AB_TEST_COMPLETED
}
