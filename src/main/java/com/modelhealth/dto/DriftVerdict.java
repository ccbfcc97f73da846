package com.modelhealth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DriftVerdict {
    String sessionId;
    EvaluationStatus status;
    boolean hasDrift;
    long predictionCount;
    Double sessionMae;
    Double baselineMae;
    Double driftFraction;
    Integer baselineSessionCount;
    int consecutiveDriftCount;
    Recommendation recommendation;
    String message;
}
