package com.riskmodels.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

@Value
@Builder
public class RolloutPlan {
    double canaryShare;
    List<Double> gradualSteps;
    Duration stepInterval;
}
