package com.modelhealth.entity;

import com.modelhealth.dto.Recommendation;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(
    name = "model_performance",
    indexes = {
        @Index(name = "idx_perf_session",  columnList = "session_id"),
        @Index(name = "idx_perf_recorded", columnList = "recorded_at"),
    }
)
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class PerformanceRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(updatable = false, nullable = false)
    private Long id;

    @Column(name = "session_id", nullable = false, updatable = false, length = 64)
    private String sessionId;

    @Column(name = "session_mae", nullable = false, updatable = false)
    private double sessionMae;

    // null while the baseline is still being built
    @Column(name = "baseline_mae", updatable = false)
    private Double baselineMae;

    @Column(name = "has_drift", nullable = false, updatable = false)
    private boolean hasDrift;

    @Column(name = "drift_fraction", updatable = false)
    private Double driftFraction;

    @Column(name = "consecutive_drift", nullable = false, updatable = false)
    private int consecutiveDriftCount;

    @Column(name = "model_version", updatable = false, length = 64)
    private String modelVersion;

    @Enumerated(EnumType.STRING)
    @Column(updatable = false, length = 32)
    private Recommendation recommendation;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    public boolean hasBaseline() {
        return baselineMae != null;
    }
}
