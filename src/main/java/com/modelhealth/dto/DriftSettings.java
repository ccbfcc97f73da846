package com.modelhealth.dto;

// threshold is a fraction of the baseline: 0.30 flags sessions 30% worse
public record DriftSettings(
    int minPredictions,
    int baselineWindow,
    int minBaselineSessions,
    double threshold,
    int urgentStreak,
    int streakLookback
) {

    public DriftSettings withOverrides(DriftCheckRequest request) {
        if (request == null) {
            return this;
        }
        return new DriftSettings(
            request.getMinPredictions() != null ? request.getMinPredictions() : minPredictions,
            request.getBaselineWindow() != null ? request.getBaselineWindow() : baselineWindow,
            request.getMinBaselineSessions() != null ? request.getMinBaselineSessions() : minBaselineSessions,
            request.getThreshold() != null ? request.getThreshold() : threshold,
            urgentStreak,
            streakLookback
        );
    }
}
