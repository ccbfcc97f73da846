package com.modelhealth.controller;

import com.modelhealth.client.MlApiClient;
import com.modelhealth.config.RequestIdFilter;
import com.modelhealth.dto.DriftCheckRequest;
import com.modelhealth.dto.DriftVerdict;
import com.modelhealth.dto.PerformanceResponse;
import com.modelhealth.dto.PredictionRequest;
import com.modelhealth.dto.PredictionResponse;
import com.modelhealth.dto.RecordResponse;
import com.modelhealth.dto.RecordStatus;
import com.modelhealth.dto.RetrainingOutcome;
import com.modelhealth.dto.SessionAccuracyResponse;
import com.modelhealth.entity.PerformanceRecord;
import com.modelhealth.entity.PredictionRecord;
import com.modelhealth.service.DriftDetector;
import com.modelhealth.service.PredictionLog;
import com.modelhealth.service.RetrainingCoordinator;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class MonitoringController {

    private final PredictionLog         predictionLog;
    private final DriftDetector         driftDetector;
    private final RetrainingCoordinator retrainingCoordinator;
    private final MlApiClient           mlApiClient;

    @PostMapping("/predictions")
    public ResponseEntity<RecordResponse> record(
            @Valid @RequestBody PredictionRequest request, HttpServletRequest httpRequest) {
        RecordStatus status = predictionLog.record(
            request.getSessionId(), request.getUnitId(), request.getGroupKey(),
            request.getPredictedValue(), request.getActualValue(), request.getModelVersion());
        log.debug("POST /predictions | sessionId={} | status={} | requestId={}",
                  request.getSessionId(), status, RequestIdFilter.requestId(httpRequest));
        return ResponseEntity.status(status == RecordStatus.RECORDED ? HttpStatus.CREATED : HttpStatus.ACCEPTED)
            .body(RecordResponse.builder()
                .status(status)
                .sessionId(request.getSessionId())
                .unitId(request.getUnitId())
                .build());
    }

    @GetMapping("/predictions")
    public ResponseEntity<List<PredictionResponse>> recentPredictions(
            @RequestParam(defaultValue = "50") @Min(1) @Max(1000) int limit) {
        return ResponseEntity.ok(predictionLog.recentPredictions(limit).stream()
            .map(this::toResponse).toList());
    }

    @GetMapping("/sessions/{sessionId}/predictions")
    public ResponseEntity<List<PredictionResponse>> sessionPredictions(@PathVariable String sessionId) {
        return ResponseEntity.ok(predictionLog.fetchSessionRecords(sessionId).stream()
            .map(this::toResponse).toList());
    }

    @GetMapping("/sessions/{sessionId}/accuracy")
    public ResponseEntity<SessionAccuracyResponse> sessionAccuracy(@PathVariable String sessionId) {
        return ResponseEntity.ok(predictionLog.sessionAccuracy(sessionId));
    }

    @PostMapping("/sessions/{sessionId}/drift-check")
    public ResponseEntity<DriftVerdict> driftCheck(
            @PathVariable String sessionId,
            @Valid @RequestBody(required = false) DriftCheckRequest request,
            HttpServletRequest httpRequest) {
        log.info("POST /sessions/{}/drift-check | requestId={}", sessionId, RequestIdFilter.requestId(httpRequest));
        return ResponseEntity.ok(driftDetector.evaluateSession(
            sessionId, driftDetector.defaultSettings().withOverrides(request)));
    }

    @PostMapping("/sessions/{sessionId}/retraining")
    public ResponseEntity<RetrainingOutcome> maybeRetrain(
            @PathVariable String sessionId,
            @RequestParam(required = false) Boolean autoRetrain,
            HttpServletRequest httpRequest) {
        log.info("POST /sessions/{}/retraining | autoRetrain={} | requestId={}",
                 sessionId, autoRetrain, RequestIdFilter.requestId(httpRequest));
        Optional<RetrainingOutcome> outcome = autoRetrain != null
            ? retrainingCoordinator.maybeRetrain(sessionId, autoRetrain)
            : retrainingCoordinator.maybeRetrain(sessionId);
        return outcome
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/retraining")
    public ResponseEntity<RetrainingOutcome> retrainNow(HttpServletRequest httpRequest) {
        log.info("POST /retraining | requestId={}", RequestIdFilter.requestId(httpRequest));
        return ResponseEntity.ok(retrainingCoordinator.retrainNow());
    }

    @GetMapping("/drift/history")
    public ResponseEntity<List<PerformanceResponse>> driftHistory(
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int limit) {
        return ResponseEntity.ok(driftDetector.driftHistory(limit).stream()
            .map(this::toResponse).toList());
    }

    @GetMapping("/drift/streak")
    public ResponseEntity<Map<String, Integer>> driftStreak() {
        return ResponseEntity.ok(Map.of("consecutiveDriftCount", driftDetector.consecutiveDriftCount()));
    }

    @GetMapping("/ml/health")
    public Mono<ResponseEntity<Map<String, Object>>> mlHealth() {
        return mlApiClient.isHealthy().map(healthy -> {
            Map<String, Object> body = Map.of("mlApi", healthy ? "UP" : "DOWN",
                                               "status", healthy ? "ok" : "degraded");
            return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(body);
        });
    }

    private PredictionResponse toResponse(PredictionRecord r) {
        return PredictionResponse.builder()
            .id(r.getId()).sessionId(r.getSessionId()).unitId(r.getUnitId()).groupKey(r.getGroupKey())
            .predictedValue(r.getPredictedValue()).actualValue(r.getActualValue())
            .absoluteError(r.getAbsoluteError()).modelVersion(r.getModelVersion())
            .recordedAt(r.getRecordedAt()).build();
    }

    private PerformanceResponse toResponse(PerformanceRecord r) {
        return PerformanceResponse.builder()
            .id(r.getId()).sessionId(r.getSessionId()).sessionMae(r.getSessionMae())
            .baselineMae(r.getBaselineMae()).hasDrift(r.isHasDrift()).driftFraction(r.getDriftFraction())
            .consecutiveDriftCount(r.getConsecutiveDriftCount()).modelVersion(r.getModelVersion())
            .recommendation(r.getRecommendation()).recordedAt(r.getRecordedAt()).build();
    }
}
