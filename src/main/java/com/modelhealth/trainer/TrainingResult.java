package com.modelhealth.trainer;

public record TrainingResult(double meanAbsoluteError, Long trainingSamples, String modelVersion) {
}
