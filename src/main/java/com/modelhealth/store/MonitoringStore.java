package com.modelhealth.store;

import com.modelhealth.entity.PerformanceRecord;
import com.modelhealth.entity.PredictionRecord;

import java.util.List;

public interface MonitoringStore {

    void appendPrediction(PredictionRecord record);

    List<PredictionRecord> queryPredictions(String sessionId);

    List<PredictionRecord> queryRecentPredictions(int limit);

    void appendPerformance(PerformanceRecord record);

    List<PerformanceRecord> queryRecentPerformance(int limit);

    // newest record per session, excluding the given one
    List<PerformanceRecord> queryBaselineWindow(String excludedSessionId, int limit);
}
