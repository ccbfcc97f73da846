package com.modelhealth.service;

import com.modelhealth.dto.DriftSettings;
import com.modelhealth.dto.DriftVerdict;
import com.modelhealth.dto.EvaluationStatus;
import com.modelhealth.dto.Recommendation;
import com.modelhealth.entity.PerformanceRecord;
import com.modelhealth.entity.PredictionRecord;
import com.modelhealth.store.MonitoringStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

@Slf4j
@Service
@RequiredArgsConstructor
public class DriftDetector {

    private final MonitoringStore store;
    private final Clock clock;
    private final ReentrantLock evaluationLock = new ReentrantLock();

    @Value("${monitoring.drift.min-predictions:5}")
    private int minPredictions = 5;

    @Value("${monitoring.drift.baseline-window:20}")
    private int baselineWindow = 20;

    @Value("${monitoring.drift.min-baseline-sessions:10}")
    private int minBaselineSessions = 10;

    @Value("${monitoring.drift.threshold:0.30}")
    private double threshold = 0.30;

    @Value("${monitoring.drift.urgent-streak:3}")
    private int urgentStreak = 3;

    @Value("${monitoring.drift.streak-lookback:50}")
    private int streakLookback = 50;

    public DriftSettings defaultSettings() {
        return new DriftSettings(minPredictions, baselineWindow, minBaselineSessions,
                                 threshold, urgentStreak, streakLookback);
    }

    public DriftVerdict evaluateSession(String sessionId) {
        return evaluateSession(sessionId, defaultSettings());
    }

    public DriftVerdict evaluateSession(String sessionId, DriftSettings settings) {
        evaluationLock.lock();
        try {
            return evaluate(sessionId, settings);
        } catch (Exception ex) {
            log.error("Drift check failed | sessionId={} | error={}", sessionId, ex.getMessage(), ex);
            return DriftVerdict.builder()
                .sessionId(sessionId)
                .status(EvaluationStatus.STORE_ERROR)
                .hasDrift(false)
                .message("Store error: " + ex.getMessage())
                .build();
        } finally {
            evaluationLock.unlock();
        }
    }

    public List<PerformanceRecord> driftHistory(int limit) {
        try {
            return store.queryRecentPerformance(limit);
        } catch (Exception ex) {
            log.error("Failed to load drift history | limit={} | error={}", limit, ex.getMessage(), ex);
            return List.of();
        }
    }

    public int consecutiveDriftCount() {
        try {
            return countConsecutiveDrift(store.queryRecentPerformance(streakLookback));
        } catch (Exception ex) {
            log.error("Failed to count consecutive drift | error={}", ex.getMessage(), ex);
            return 0;
        }
    }

    private DriftVerdict evaluate(String sessionId, DriftSettings settings) {
        List<PredictionRecord> predictions = store.queryPredictions(sessionId);
        if (predictions.size() < settings.minPredictions()) {
            log.debug("Drift check skipped | sessionId={} | predictions={} | required={}",
                      sessionId, predictions.size(), settings.minPredictions());
            return DriftVerdict.builder()
                .sessionId(sessionId)
                .status(EvaluationStatus.INSUFFICIENT_DATA)
                .hasDrift(false)
                .predictionCount(predictions.size())
                .message(String.format("Need at least %d predictions (have %d)",
                                       settings.minPredictions(), predictions.size()))
                .build();
        }

        double sessionMae = predictions.stream()
            .mapToDouble(PredictionRecord::getAbsoluteError)
            .average()
            .orElse(0.0);
        String modelVersion = predictions.stream()
            .max(Comparator.comparing(PredictionRecord::getRecordedAt))
            .map(PredictionRecord::getModelVersion)
            .orElse(null);

        List<PerformanceRecord> window = store.queryBaselineWindow(sessionId, settings.baselineWindow());
        if (window.size() < settings.minBaselineSessions()) {
            store.appendPerformance(PerformanceRecord.builder()
                .sessionId(sessionId)
                .sessionMae(sessionMae)
                .hasDrift(false)
                .consecutiveDriftCount(0)
                .modelVersion(modelVersion)
                .recommendation(Recommendation.BUILDING_BASELINE)
                .recordedAt(clock.instant())
                .build());

            log.info("Drift check | sessionId={} | mae={} | building baseline ({}/{} sessions)",
                     sessionId, sessionMae, window.size(), settings.minBaselineSessions());
            return DriftVerdict.builder()
                .sessionId(sessionId)
                .status(EvaluationStatus.BUILDING_BASELINE)
                .hasDrift(false)
                .predictionCount(predictions.size())
                .sessionMae(sessionMae)
                .baselineSessionCount(window.size())
                .consecutiveDriftCount(0)
                .recommendation(Recommendation.BUILDING_BASELINE)
                .message(String.format("Building baseline (need %d+ sessions, have %d)",
                                       settings.minBaselineSessions(), window.size()))
                .build();
        }

        double baselineMae = median(window.stream().mapToDouble(PerformanceRecord::getSessionMae).toArray());
        Double driftFraction = baselineMae > 0.0 ? (sessionMae - baselineMae) / baselineMae : null;
        boolean hasDrift = driftFraction != null ? driftFraction > settings.threshold() : sessionMae > 0.0;

        PerformanceRecord.PerformanceRecordBuilder current = PerformanceRecord.builder()
            .sessionId(sessionId)
            .sessionMae(sessionMae)
            .baselineMae(baselineMae)
            .hasDrift(hasDrift)
            .driftFraction(driftFraction)
            .modelVersion(modelVersion)
            .recordedAt(clock.instant());

        // The walk starts at the record about to be written, then continues into stored history.
        List<PerformanceRecord> walk = new ArrayList<>();
        walk.add(current.build());
        walk.addAll(store.queryRecentPerformance(settings.streakLookback()));
        int consecutive = countConsecutiveDrift(walk);
        Recommendation recommendation = recommend(hasDrift, consecutive, settings.urgentStreak());

        store.appendPerformance(current
            .consecutiveDriftCount(consecutive)
            .recommendation(recommendation)
            .build());

        if (hasDrift) {
            log.warn("Drift detected | sessionId={} | mae={} | baseline={} | drift={} | consecutive={} | recommendation={}",
                     sessionId, sessionMae, baselineMae, driftFraction, consecutive, recommendation);
        } else {
            log.info("Drift check | sessionId={} | mae={} | baseline={} | drift={} | consecutive={}",
                     sessionId, sessionMae, baselineMae, driftFraction, consecutive);
        }

        return DriftVerdict.builder()
            .sessionId(sessionId)
            .status(EvaluationStatus.EVALUATED)
            .hasDrift(hasDrift)
            .predictionCount(predictions.size())
            .sessionMae(sessionMae)
            .baselineMae(baselineMae)
            .driftFraction(driftFraction)
            .baselineSessionCount(window.size())
            .consecutiveDriftCount(consecutive)
            .recommendation(recommendation)
            .message(driftFraction != null
                ? String.format("Session MAE %.2f vs baseline %.2f (%+.1f%%)", sessionMae, baselineMae, driftFraction * 100)
                : String.format("Session MAE %.2f vs baseline %.2f", sessionMae, baselineMae))
            .build();
    }

    // a session evaluated more than once counts once, at its newest record
    static int countConsecutiveDrift(List<PerformanceRecord> newestFirst) {
        Set<String> seen = new HashSet<>();
        int consecutive = 0;
        for (PerformanceRecord record : newestFirst) {
            if (!seen.add(record.getSessionId())) {
                continue;
            }
            if (!record.isHasDrift() || !record.hasBaseline()) {
                break;
            }
            consecutive++;
        }
        return consecutive;
    }

    static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1
            ? sorted[mid]
            : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    private Recommendation recommend(boolean hasDrift, int consecutive, int urgentAfter) {
        if (consecutive >= urgentAfter) {
            return Recommendation.RETRAIN_URGENT;
        }
        return hasDrift ? Recommendation.MONITOR : Recommendation.OK;
    }
}
