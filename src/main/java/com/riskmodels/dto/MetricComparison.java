package com.riskmodels.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MetricComparison {
    String metric;
    double candidateValue;
    double productionValue;
    double improvementPct;
}
