package com.riskmodels.dto;

public enum AbTestStatus {
    ACTIVE,
    COMPLETED
}
