package com.modelhealth.service;

import com.modelhealth.dto.DriftSettings;
import com.modelhealth.dto.DriftVerdict;
import com.modelhealth.dto.EvaluationStatus;
import com.modelhealth.dto.Recommendation;
import com.modelhealth.entity.PerformanceRecord;
import com.modelhealth.entity.PredictionRecord;
import com.modelhealth.store.InMemoryMonitoringStore;
import com.modelhealth.store.MonitoringStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class DriftDetectorTest {

    private static final Instant NOW = Instant.parse("2026-05-10T18:00:00Z");
    private static final double[] PRIOR_MAES = {8, 9, 8, 7, 9, 8, 8, 9, 8, 7};

    private InMemoryMonitoringStore store;
    private DriftDetector detector;

    @BeforeEach
    void setUp() {
        store = new InMemoryMonitoringStore();
        detector = new DriftDetector(store, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void logSession(String sessionId, double... errors) {
        for (int i = 0; i < errors.length; i++) {
            store.appendPrediction(PredictionRecord.builder()
                .sessionId(sessionId).unitId(sessionId + "-" + i).groupKey("7-iron")
                .predictedValue(150.0 + errors[i]).actualValue(150.0)
                .modelVersion("v2").recordedAt(NOW.minusSeconds(60 - i)).build());
        }
    }

    private void logSessionWithMae(String sessionId, double mae) {
        logSession(sessionId, mae, mae, mae, mae, mae);
    }

    private void seedPerformance(String sessionId, double mae, Double baseline, boolean drift, long hoursAgo) {
        store.appendPerformance(PerformanceRecord.builder()
            .sessionId(sessionId).sessionMae(mae).baselineMae(baseline).hasDrift(drift)
            .recordedAt(NOW.minus(hoursAgo, ChronoUnit.HOURS)).build());
    }

    private void seedPriorSessions() {
        for (int i = 0; i < PRIOR_MAES.length; i++) {
            seedPerformance("prior-" + i, PRIOR_MAES[i], null, false, 100L - i);
        }
    }

    @Test
    void evaluate_tooFewPredictions_returnsInsufficientDataWithoutPersisting() {
        logSession("short", 2, 2, 2, 2);

        DriftVerdict verdict = detector.evaluateSession("short");

        assertThat(verdict.getStatus()).isEqualTo(EvaluationStatus.INSUFFICIENT_DATA);
        assertThat(verdict.isHasDrift()).isFalse();
        assertThat(verdict.getBaselineMae()).isNull();
        assertThat(verdict.getMessage()).contains("Need at least 5 predictions (have 4)");
        assertThat(store.performanceRecords()).isEmpty();
    }

    @Test
    void evaluate_withoutHistory_buildsBaseline() {
        logSession("session-a", 2, 2, 2, 2, 2);

        DriftVerdict verdict = detector.evaluateSession("session-a");

        assertThat(verdict.getStatus()).isEqualTo(EvaluationStatus.BUILDING_BASELINE);
        assertThat(verdict.getRecommendation()).isEqualTo(Recommendation.BUILDING_BASELINE);
        assertThat(verdict.isHasDrift()).isFalse();
        assertThat(verdict.getSessionMae()).isEqualTo(2.0);
        assertThat(verdict.getBaselineMae()).isNull();

        assertThat(store.performanceRecords()).singleElement().satisfies(r -> {
            assertThat(r.getSessionMae()).isEqualTo(2.0);
            assertThat(r.getBaselineMae()).isNull();
            assertThat(r.isHasDrift()).isFalse();
            assertThat(r.getModelVersion()).isEqualTo("v2");
        });
    }

    @Test
    void evaluate_firstSessionAboveThreshold_isMonitor() {
        seedPriorSessions();
        logSessionWithMae("session-b", 11.0);

        DriftVerdict verdict = detector.evaluateSession("session-b");

        assertThat(verdict.getStatus()).isEqualTo(EvaluationStatus.EVALUATED);
        assertThat(verdict.getBaselineMae()).isEqualTo(8.0);
        assertThat(verdict.getDriftFraction()).isEqualTo(0.375);
        assertThat(verdict.isHasDrift()).isTrue();
        assertThat(verdict.getConsecutiveDriftCount()).isEqualTo(1);
        assertThat(verdict.getRecommendation()).isEqualTo(Recommendation.MONITOR);
    }

    @Test
    void evaluate_thirdConsecutiveDriftSession_isRetrainUrgent() {
        seedPriorSessions();

        logSessionWithMae("drift-1", 11.0);
        DriftVerdict first = detector.evaluateSession("drift-1");
        logSessionWithMae("drift-2", 11.0);
        DriftVerdict second = detector.evaluateSession("drift-2");
        logSessionWithMae("drift-3", 11.0);
        DriftVerdict third = detector.evaluateSession("drift-3");

        assertThat(first.getConsecutiveDriftCount()).isEqualTo(1);
        assertThat(second.getConsecutiveDriftCount()).isEqualTo(2);
        assertThat(second.getRecommendation()).isEqualTo(Recommendation.MONITOR);
        assertThat(third.getConsecutiveDriftCount()).isEqualTo(3);
        assertThat(third.getBaselineMae()).isEqualTo(8.0);
        assertThat(third.getRecommendation()).isEqualTo(Recommendation.RETRAIN_URGENT);
        assertThat(detector.consecutiveDriftCount()).isEqualTo(3);
    }

    @Test
    void evaluate_belowThreshold_isNotDrift() {
        seedPriorSessions();
        logSessionWithMae("session-c", 10.0);

        DriftVerdict verdict = detector.evaluateSession("session-c");

        assertThat(verdict.getDriftFraction()).isEqualTo(0.25);
        assertThat(verdict.isHasDrift()).isFalse();
        assertThat(verdict.getConsecutiveDriftCount()).isZero();
        assertThat(verdict.getRecommendation()).isEqualTo(Recommendation.OK);
    }

    @Test
    void evaluate_baselineIsMedianSoOutlierDoesNotShiftIt() {
        for (int i = 0; i < 10; i++) {
            seedPerformance("prior-" + i, i == 4 ? 800.0 : 8.0, null, false, 50L - i);
        }
        logSessionWithMae("session-d", 11.0);

        DriftVerdict verdict = detector.evaluateSession("session-d");

        // a mean baseline would be 87.2 and hide the degradation
        assertThat(verdict.getBaselineMae()).isEqualTo(8.0);
        assertThat(verdict.isHasDrift()).isTrue();
    }

    @Test
    void evaluate_driftMatchesRelativeExcessOverBaseline() {
        double[] sessionMaes = {6.0, 8.0, 9.5, 10.0, 10.2, 10.6, 11.0, 14.0};
        for (double mae : sessionMaes) {
            setUp();
            seedPriorSessions();
            logSessionWithMae("probe", mae);

            DriftVerdict verdict = detector.evaluateSession("probe");

            assertThat(verdict.isHasDrift())
                .as("session MAE %s", mae)
                .isEqualTo(verdict.getSessionMae() > verdict.getBaselineMae() * 1.30);
        }
    }

    @Test
    void evaluate_customThresholdAndWindowAreHonoured() {
        seedPriorSessions();
        logSessionWithMae("session-e", 9.0);

        DriftVerdict verdict = detector.evaluateSession("session-e",
            new DriftSettings(5, 5, 5, 0.10, 3, 50));

        // five most recent priors, newest first: 7, 8, 9, 8, 8
        assertThat(verdict.getBaselineSessionCount()).isEqualTo(5);
        assertThat(verdict.getBaselineMae()).isEqualTo(8.0);
        assertThat(verdict.isHasDrift()).isTrue();
    }

    @Test
    void evaluate_streakStopsAtFirstSessionWithoutDrift() {
        seedPriorSessions();
        seedPerformance("older-drift", 12.0, 8.0, true, 6);
        seedPerformance("recovered", 8.5, 8.0, false, 5);
        seedPerformance("recent-drift", 12.0, 8.0, true, 4);
        logSessionWithMae("session-f", 11.0);

        DriftVerdict verdict = detector.evaluateSession("session-f");

        assertThat(verdict.getConsecutiveDriftCount()).isEqualTo(2);
        assertThat(verdict.getRecommendation()).isEqualTo(Recommendation.MONITOR);
    }

    @Test
    void evaluate_sameSessionTwice_doesNotInflateStreak() {
        seedPriorSessions();
        seedPerformance("drift-1", 12.0, 8.0, true, 3);
        logSessionWithMae("drift-2", 11.0);

        DriftVerdict first = detector.evaluateSession("drift-2");
        DriftVerdict again = detector.evaluateSession("drift-2");

        assertThat(first.getConsecutiveDriftCount()).isEqualTo(2);
        assertThat(again.getConsecutiveDriftCount()).isEqualTo(2);
        assertThat(again.getRecommendation()).isEqualTo(Recommendation.MONITOR);
    }

    @Test
    void evaluate_reEvaluatedSessionCountsOnceTowardBaseline() {
        for (int i = 0; i < 9; i++) {
            logSessionWithMae("p" + i, 8.0);
            detector.evaluateSession("p" + i);
        }
        detector.evaluateSession("p8");
        logSessionWithMae("p9", 8.0);

        DriftVerdict verdict = detector.evaluateSession("p9");

        assertThat(store.performanceRecords()).hasSize(11);
        assertThat(verdict.getStatus()).isEqualTo(EvaluationStatus.BUILDING_BASELINE);
        assertThat(verdict.getBaselineSessionCount()).isEqualTo(9);
    }

    @Test
    void evaluate_duplicateRecordsDoNotWeightTheMedian() {
        for (int i = 0; i < 5; i++) {
            seedPerformance("steady-" + i, 8.0, null, false, 40L - i);
            seedPerformance("noisy-" + i, 10.0, null, false, 30L - i);
        }
        seedPerformance("noisy-4", 10.0, 9.0, false, 20);
        logSessionWithMae("session-h", 11.0);

        DriftVerdict verdict = detector.evaluateSession("session-h");

        assertThat(verdict.getBaselineSessionCount()).isEqualTo(10);
        assertThat(verdict.getBaselineMae()).isEqualTo(9.0);
    }

    @Test
    void countConsecutiveDrift_stopsAtNullBaseline() {
        List<PerformanceRecord> newestFirst = List.of(
            PerformanceRecord.builder().sessionId("c").sessionMae(12).baselineMae(8.0).hasDrift(true).recordedAt(NOW).build(),
            PerformanceRecord.builder().sessionId("b").sessionMae(12).hasDrift(true).recordedAt(NOW).build(),
            PerformanceRecord.builder().sessionId("a").sessionMae(12).baselineMae(8.0).hasDrift(true).recordedAt(NOW).build());

        assertThat(DriftDetector.countConsecutiveDrift(newestFirst)).isEqualTo(1);
    }

    @Test
    void median_handlesOddAndEvenCounts() {
        assertThat(DriftDetector.median(new double[] {3, 1, 2})).isEqualTo(2.0);
        assertThat(DriftDetector.median(new double[] {4, 1, 3, 2})).isEqualTo(2.5);
    }

    @Test
    void evaluate_storeFailure_degradesToNoDrift() {
        MonitoringStore broken = mock(MonitoringStore.class);
        when(broken.queryPredictions(anyString())).thenThrow(new IllegalStateException("database is locked"));
        DriftDetector failing = new DriftDetector(broken, Clock.fixed(NOW, ZoneOffset.UTC));

        DriftVerdict verdict = failing.evaluateSession("session-g");

        assertThat(verdict.getStatus()).isEqualTo(EvaluationStatus.STORE_ERROR);
        assertThat(verdict.isHasDrift()).isFalse();
        assertThat(verdict.getMessage()).contains("database is locked");
        assertThat(failing.driftHistory(10)).isEmpty();
    }
}
