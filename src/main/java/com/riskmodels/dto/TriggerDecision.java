package com.riskmodels.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

@Value
@Builder
public class TriggerDecision {
    String modelName;
    Set<TriggerReason> reasons;
    boolean driftVerdictAvailable;
    Long newRecordCount;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant lastTrainedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant evaluatedAt;
    String requestedBy;

    @JsonIgnore
    public boolean shouldRetrain() {
        return reasons != null && !reasons.isEmpty();
    }
}
