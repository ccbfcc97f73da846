package com.modelhealth.service;

import com.modelhealth.dto.RecordStatus;
import com.modelhealth.dto.SessionAccuracyResponse;
import com.modelhealth.entity.PredictionRecord;
import com.modelhealth.store.MonitoringStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class PredictionLog {

    private final MonitoringStore store;
    private final Clock clock;

    @Value("${monitoring.predictions.sentinel-values:0,99999}")
    private double[] sentinelValues = {0.0, 99999.0};

    public RecordStatus record(String sessionId, String unitId, String groupKey,
                               Double predictedValue, Double actualValue, String modelVersion) {
        try {
            if (sessionId == null || sessionId.isBlank() || !isMeasured(predictedValue) || !isMeasured(actualValue)) {
                log.debug("Prediction skipped | sessionId={} | unitId={} | predicted={} | actual={}",
                          sessionId, unitId, predictedValue, actualValue);
                return RecordStatus.SKIPPED;
            }

            PredictionRecord record = PredictionRecord.builder()
                .sessionId(sessionId).unitId(unitId).groupKey(groupKey)
                .predictedValue(predictedValue).actualValue(actualValue)
                .modelVersion(modelVersion).recordedAt(clock.instant())
                .build();
            store.appendPrediction(record);

            log.debug("Prediction logged | sessionId={} | unitId={} | predicted={} | actual={} | error={}",
                      sessionId, unitId, predictedValue, actualValue, record.getAbsoluteError());
            return RecordStatus.RECORDED;
        } catch (Exception ex) {
            log.error("Failed to log prediction | sessionId={} | unitId={} | error={}",
                      sessionId, unitId, ex.getMessage(), ex);
            return RecordStatus.SKIPPED;
        }
    }

    public List<PredictionRecord> fetchSessionRecords(String sessionId) {
        try {
            return store.queryPredictions(sessionId);
        } catch (Exception ex) {
            log.error("Failed to load session predictions | sessionId={} | error={}", sessionId, ex.getMessage(), ex);
            return List.of();
        }
    }

    public List<PredictionRecord> recentPredictions(int limit) {
        try {
            return store.queryRecentPredictions(limit);
        } catch (Exception ex) {
            log.error("Failed to load prediction history | limit={} | error={}", limit, ex.getMessage(), ex);
            return List.of();
        }
    }

    public SessionAccuracyResponse sessionAccuracy(String sessionId) {
        List<PredictionRecord> records = fetchSessionRecords(sessionId);
        if (records.isEmpty()) {
            return SessionAccuracyResponse.builder()
                .sessionId(sessionId)
                .sampleCount(0)
                .build();
        }

        double absErrorSum = 0.0;
        double squaredErrorSum = 0.0;
        for (PredictionRecord record : records) {
            double error = record.getPredictedValue() - record.getActualValue();
            absErrorSum += Math.abs(error);
            squaredErrorSum += error * error;
        }

        double n = records.size();
        return SessionAccuracyResponse.builder()
            .sessionId(sessionId)
            .sampleCount(records.size())
            .mae(absErrorSum / n)
            .rmse(Math.sqrt(squaredErrorSum / n))
            .build();
    }

    private boolean isMeasured(Double value) {
        if (value == null || value.isNaN() || value.isInfinite()) {
            return false;
        }
        if (sentinelValues != null) {
            for (double sentinel : sentinelValues) {
                if (value == sentinel) {
                    return false;
                }
            }
        }
        return true;
    }
}
