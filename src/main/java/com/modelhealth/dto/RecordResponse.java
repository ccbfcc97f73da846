package com.modelhealth.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RecordResponse {
    RecordStatus status;
    String sessionId;
    String unitId;
}
