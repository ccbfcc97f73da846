package com.modelhealth.dto;

public enum RetrainingMode {
    ALERT_ONLY,
    AUTO,
    MANUAL
}
