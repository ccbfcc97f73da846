package com.modelhealth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RetrainingOutcome {
    String sessionId;
    boolean triggered;
    RetrainingMode mode;
    Boolean succeeded;
    Double newMae;
    Double elapsedSeconds;
    String error;
    Integer consecutiveDriftCount;
    String message;
}
