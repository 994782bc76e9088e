package com.riskmodels.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class DriftCheckResult {
    String modelName;
    String referenceVersionId;
    List<DriftReport> reports;
    boolean driftDetected;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant checkedAt;

    public List<DriftReport> driftedFeatures() {
        return reports.stream().filter(DriftReport::isExceeded).toList();
    }

    public DriftCheckResult withReferenceVersion(String versionId) {
        return new DriftCheckResult(modelName, versionId, reports, driftDetected, checkedAt);
    }
}
