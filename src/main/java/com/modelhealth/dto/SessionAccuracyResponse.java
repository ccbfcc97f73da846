package com.modelhealth.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SessionAccuracyResponse {
    String sessionId;
    long sampleCount;
    Double mae;
    Double rmse;
}
