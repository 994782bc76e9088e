package com.riskmodels.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class AbTestResponse {
    String testId;
    String modelName;
    RolloutStrategy strategy;
    AbTestStatus status;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant startedAt;
    /** {@code null} for a test without a planned duration. */
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant plannedEndAt;
    Long remainingDays;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant endedAt;
    int minSamplesPerVariant;
    boolean minSamplesReached;
    boolean durationElapsed;
    /** Active and either every variant has enough outcomes or the planned duration is over. */
    boolean readyToConclude;
    String winnerVersionId;
    List<VariantStats> variants;

    @Value
    @Builder
    public static class VariantStats {
        String versionId;
        double weight;
        long requests;
        long successes;
        long failures;
        Double successRate;
        Double meanMetric;
        long metricCount;
    }
}
