package com.modelhealth.dto;

public enum Recommendation {
    BUILDING_BASELINE,
    OK,
    MONITOR,
    RETRAIN_URGENT
}
