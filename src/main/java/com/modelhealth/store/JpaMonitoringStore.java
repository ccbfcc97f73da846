package com.modelhealth.store;

import com.modelhealth.entity.PerformanceRecord;
import com.modelhealth.entity.PredictionRecord;
import com.modelhealth.repository.PerformanceRecordRepository;
import com.modelhealth.repository.PredictionRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Component
@RequiredArgsConstructor
public class JpaMonitoringStore implements MonitoringStore {

    private final PredictionRecordRepository predictionRepository;
    private final PerformanceRecordRepository performanceRepository;

    @Override
    @Transactional
    public void appendPrediction(PredictionRecord record) {
        predictionRepository.save(record);
    }

    @Override
    @Transactional(readOnly = true)
    public List<PredictionRecord> queryPredictions(String sessionId) {
        return predictionRepository.findBySessionIdOrderByRecordedAtAsc(sessionId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<PredictionRecord> queryRecentPredictions(int limit) {
        return predictionRepository.findAllByOrderByRecordedAtDesc(PageRequest.of(0, limit));
    }

    @Override
    @Transactional
    public void appendPerformance(PerformanceRecord record) {
        performanceRepository.save(record);
    }

    @Override
    @Transactional(readOnly = true)
    public List<PerformanceRecord> queryRecentPerformance(int limit) {
        return performanceRepository.findAllByOrderByRecordedAtDescIdDesc(PageRequest.of(0, limit));
    }

    @Override
    @Transactional(readOnly = true)
    public List<PerformanceRecord> queryBaselineWindow(String excludedSessionId, int limit) {
        return performanceRepository.findLatestPerSessionExcluding(excludedSessionId, PageRequest.of(0, limit));
    }
}
