package com.modelhealth.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PredictionResponse {
    UUID id;
    String sessionId;
    String unitId;
    String groupKey;
    double predictedValue;
    double actualValue;
    double absoluteError;
    String modelVersion;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant recordedAt;
}
