package com.riskmodels.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class DriftReport {
    String modelName;
    String featureName;
    double ksStatistic;
    double ksPValue;
    double psi;
    double significanceLevel;
    double psiThreshold;
    boolean exceeded;
    int referenceSize;
    int recentSize;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant timestamp;

    public boolean ksExceeded() {
        return ksPValue < significanceLevel;
    }

    public boolean psiExceeded() {
        return psi > psiThreshold;
    }
}
