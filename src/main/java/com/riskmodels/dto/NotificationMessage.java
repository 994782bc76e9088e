package com.riskmodels.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class NotificationMessage {
    NotificationType type;
    String modelName;
    String subject;
    String body;
    Map<String, Object> attributes;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
}
