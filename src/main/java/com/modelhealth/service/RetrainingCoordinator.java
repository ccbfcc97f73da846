package com.modelhealth.service;

import com.modelhealth.dto.DriftVerdict;
import com.modelhealth.dto.RetrainingMode;
import com.modelhealth.dto.RetrainingOutcome;
import com.modelhealth.exception.ModelHealthException;
import com.modelhealth.trainer.ModelTrainer;
import com.modelhealth.trainer.TrainingResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Function;

@Slf4j
@Service
@RequiredArgsConstructor
public class RetrainingCoordinator {

    private final DriftDetector driftDetector;
    private final ModelTrainer modelTrainer;
    private final Clock clock;

    @Value("${monitoring.retraining.auto-enabled:false}")
    private boolean autoRetrainEnabled = false;

    @Value("${monitoring.drift.urgent-streak:3}")
    private int urgentStreak = 3;

    public Optional<RetrainingOutcome> maybeRetrain(String sessionId) {
        return maybeRetrain(sessionId, autoRetrainEnabled);
    }

    public Optional<RetrainingOutcome> maybeRetrain(String sessionId, boolean autoRetrain) {
        return maybeRetrain(sessionId, autoRetrain, driftDetector::evaluateSession, modelTrainer);
    }

    public Optional<RetrainingOutcome> maybeRetrain(String sessionId, boolean autoRetrain,
                                                    Function<String, DriftVerdict> evaluateFn,
                                                    ModelTrainer trainer) {
        DriftVerdict verdict;
        try {
            verdict = evaluateFn.apply(sessionId);
        } catch (Exception ex) {
            log.error("Drift evaluation failed before retraining decision | sessionId={} | error={}",
                      sessionId, ex.getMessage(), ex);
            return Optional.empty();
        }

        if (verdict == null || !verdict.isHasDrift()) {
            return Optional.empty();
        }

        int consecutive = verdict.getConsecutiveDriftCount();
        if (consecutive < urgentStreak) {
            log.info("Retraining not needed yet | sessionId={} | consecutive={} | required={}",
                     sessionId, consecutive, urgentStreak);
            return Optional.of(RetrainingOutcome.builder()
                .sessionId(sessionId)
                .triggered(false)
                .mode(RetrainingMode.ALERT_ONLY)
                .consecutiveDriftCount(consecutive)
                .message(String.format("Drift detected (%d consecutive session%s). Monitor closely.",
                                       consecutive, consecutive == 1 ? "" : "s"))
                .build());
        }

        if (!autoRetrain) {
            log.warn("Retraining recommended | sessionId={} | consecutive={} | autoRetrain=false",
                     sessionId, consecutive);
            return Optional.of(RetrainingOutcome.builder()
                .sessionId(sessionId)
                .triggered(false)
                .mode(RetrainingMode.ALERT_ONLY)
                .consecutiveDriftCount(consecutive)
                .message(String.format("URGENT: drift in %d consecutive sessions. Manual retraining recommended.",
                                       consecutive))
                .build());
        }

        log.warn("Auto-retraining triggered | sessionId={} | consecutive={}", sessionId, consecutive);
        return Optional.of(runTraining(sessionId, RetrainingMode.AUTO, consecutive, trainer));
    }

    public RetrainingOutcome retrainNow() {
        log.info("Manual retraining requested");
        return runTraining(null, RetrainingMode.MANUAL, null, modelTrainer);
    }

    private RetrainingOutcome runTraining(String sessionId, RetrainingMode mode,
                                          Integer consecutive, ModelTrainer trainer) {
        Instant start = clock.instant();
        try {
            TrainingResult result = trainer.train();
            double elapsed = elapsedSeconds(start);
            if (result == null) {
                log.error("Retraining failed | sessionId={} | mode={} | error=no result", sessionId, mode);
                return failure(sessionId, mode, consecutive, elapsed, "Trainer returned no result");
            }
            log.info("Retraining succeeded | sessionId={} | mode={} | newMae={} | elapsedSeconds={}",
                     sessionId, mode, result.meanAbsoluteError(), elapsed);
            return RetrainingOutcome.builder()
                .sessionId(sessionId)
                .triggered(true)
                .mode(mode)
                .succeeded(true)
                .newMae(result.meanAbsoluteError())
                .elapsedSeconds(elapsed)
                .consecutiveDriftCount(consecutive)
                .message(String.format("Model retrained in %.1fs (new MAE %.2f)",
                                       elapsed, result.meanAbsoluteError()))
                .build();
        } catch (Exception ex) {
            String error = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            String code = "TRAINER_ERROR";
            boolean retryable = false;
            if (ex instanceof ModelHealthException) {
                code = ((ModelHealthException) ex).getErrorCode();
                retryable = ((ModelHealthException) ex).isRetryable();
            }
            log.error("Retraining failed | sessionId={} | mode={} | code={} | retryable={} | error={}",
                      sessionId, mode, code, retryable, error, ex);
            return failure(sessionId, mode, consecutive, elapsedSeconds(start), error);
        }
    }

    private RetrainingOutcome failure(String sessionId, RetrainingMode mode, Integer consecutive,
                                      double elapsed, String error) {
        return RetrainingOutcome.builder()
            .sessionId(sessionId)
            .triggered(true)
            .mode(mode)
            .succeeded(false)
            .elapsedSeconds(elapsed)
            .error(error)
            .consecutiveDriftCount(consecutive)
            .message("Retraining failed: " + error)
            .build();
    }

    private double elapsedSeconds(Instant start) {
        return Duration.between(start, clock.instant()).toMillis() / 1000.0;
    }
}
