package com.modelhealth.trainer;

import com.modelhealth.client.MlApiClient;
import com.modelhealth.exception.MlApiException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
public class MlApiModelTrainer implements ModelTrainer {

    private final MlApiClient mlApiClient;

    @Override
    public TrainingResult train() {
        String requestId = UUID.randomUUID().toString();
        MlApiClient.MlTrainResult result = mlApiClient.train(requestId)
            .blockOptional()
            .orElseThrow(() -> new MlApiException("ML API returned an empty training response"));
        log.info("Training finished | mae={} | samples={} | modelVersion={} | requestId={}",
                 result.mae(), result.trainingSamples(), result.modelVersion(), requestId);
        return new TrainingResult(result.mae(), result.trainingSamples(), result.modelVersion());
    }
}
