package com.modelhealth.dto;

public enum EvaluationStatus {
    INSUFFICIENT_DATA,
    BUILDING_BASELINE,
    EVALUATED,
    STORE_ERROR
}
