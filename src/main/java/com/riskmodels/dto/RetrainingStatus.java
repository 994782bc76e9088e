package com.riskmodels.dto;

public enum RetrainingStatus {
    COMPLETED,
    FAILED
}
