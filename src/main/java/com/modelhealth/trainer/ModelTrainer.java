package com.modelhealth.trainer;

@FunctionalInterface
public interface ModelTrainer {

    TrainingResult train() throws Exception;
}
