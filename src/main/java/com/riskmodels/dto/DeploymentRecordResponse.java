package com.riskmodels.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.riskmodels.entity.DeploymentAction;
import com.riskmodels.entity.ModelStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class DeploymentRecordResponse {
    String modelName;
    String versionId;
    long sequence;
    DeploymentAction action;
    ModelStatus previousStatus;
    ModelStatus newStatus;
    String replacedVersionId;
    String actor;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant occurredAt;
    String reason;
}
