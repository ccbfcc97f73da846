package com.modelhealth.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "model_predictions",
    indexes = {
        @Index(name = "idx_pred_session",  columnList = "session_id"),
        @Index(name = "idx_pred_recorded", columnList = "recorded_at"),
    }
)
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PredictionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "session_id", nullable = false, updatable = false, length = 64)
    private String sessionId;

    @Column(name = "unit_id", nullable = false, updatable = false, length = 64)
    private String unitId;

    @Column(name = "group_key", updatable = false, length = 50)
    private String groupKey;

    @Column(name = "predicted_value", nullable = false, updatable = false)
    private double predictedValue;

    @Column(name = "actual_value", nullable = false, updatable = false)
    private double actualValue;

    @Column(name = "absolute_error", nullable = false, updatable = false)
    private double absoluteError;

    @Column(name = "model_version", updatable = false, length = 64)
    private String modelVersion;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    @Builder
    private PredictionRecord(String sessionId, String unitId, String groupKey,
                             double predictedValue, double actualValue,
                             String modelVersion, Instant recordedAt) {
        this.sessionId = sessionId;
        this.unitId = unitId;
        this.groupKey = groupKey;
        this.predictedValue = predictedValue;
        this.actualValue = actualValue;
        this.absoluteError = Math.abs(predictedValue - actualValue);
        this.modelVersion = modelVersion;
        this.recordedAt = recordedAt;
    }
}
