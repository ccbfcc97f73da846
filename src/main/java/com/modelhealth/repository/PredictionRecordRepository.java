package com.modelhealth.repository;

import com.modelhealth.entity.PredictionRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface PredictionRecordRepository extends JpaRepository<PredictionRecord, UUID> {

    List<PredictionRecord> findBySessionIdOrderByRecordedAtAsc(String sessionId);

    List<PredictionRecord> findAllByOrderByRecordedAtDesc(Pageable pageable);
}
