package com.modelhealth.dto;

public enum RecordStatus {
    RECORDED,
    SKIPPED
}
