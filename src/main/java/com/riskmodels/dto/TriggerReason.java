package com.riskmodels.dto;

public enum TriggerReason {
    DRIFT,
    VOLUME,
    SCHEDULE,
    FORCED
}
