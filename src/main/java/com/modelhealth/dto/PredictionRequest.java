package com.modelhealth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class PredictionRequest {

    @NotBlank(message = "sessionId is required")
    @Size(max = 64, message = "sessionId must be at most 64 characters")
    String sessionId;

    @NotBlank(message = "unitId is required")
    @Size(max = 64, message = "unitId must be at most 64 characters")
    String unitId;

    @Size(max = 50, message = "groupKey must be at most 50 characters")
    String groupKey;

    Double predictedValue;

    Double actualValue;

    @Size(max = 64, message = "modelVersion must be at most 64 characters")
    String modelVersion;
}
