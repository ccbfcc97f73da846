package com.modelhealth.repository;

import com.modelhealth.entity.PerformanceRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface PerformanceRecordRepository extends JpaRepository<PerformanceRecord, Long> {

    List<PerformanceRecord> findAllByOrderByRecordedAtDescIdDesc(Pageable pageable);

    @Query("""
        SELECT p FROM PerformanceRecord p
        WHERE p.sessionId <> :excluded
          AND p.id = (SELECT MAX(q.id) FROM PerformanceRecord q WHERE q.sessionId = p.sessionId)
        ORDER BY p.recordedAt DESC, p.id DESC
        """)
    List<PerformanceRecord> findLatestPerSessionExcluding(
        @Param("excluded") String excludedSessionId, Pageable pageable);
}
