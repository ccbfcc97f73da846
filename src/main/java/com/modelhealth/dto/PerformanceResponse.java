package com.modelhealth.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PerformanceResponse {
    Long id;
    String sessionId;
    double sessionMae;
    Double baselineMae;
    boolean hasDrift;
    Double driftFraction;
    int consecutiveDriftCount;
    String modelVersion;
    Recommendation recommendation;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant recordedAt;
}
