package com.modelhealth.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class DriftCheckRequest {

    @Min(value = 1, message = "minPredictions must be >= 1")
    Integer minPredictions;

    @Min(value = 1, message = "baselineWindow must be >= 1")
    @Max(value = 500, message = "baselineWindow must be <= 500")
    Integer baselineWindow;

    @Min(value = 1, message = "minBaselineSessions must be >= 1")
    Integer minBaselineSessions;

    @DecimalMin(value = "0.0", inclusive = false, message = "threshold must be > 0")
    Double threshold;
}
