package com.riskmodels.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RouteDecision {
    String modelName;
    String versionId;
    String testId;
    Integer bucket;
}
