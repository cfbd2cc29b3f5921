package com.batchpredict.worker.workflow;

import com.batchpredict.config.PredictConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PredictionRunRequestTest {

    @Test
    void timeouts_fallBackToConfigurationDefaults() {
        PredictionRunRequest request = new PredictionRunRequest(24, 0, -1, 0);
        PredictConfig defaults = PredictConfig.builder().build();

        assertEquals(defaults.getQueryTimeout(), request.queryTimeout());
        assertEquals(defaults.getDispatchTimeout(), request.dispatchTimeout());
        assertEquals(defaults.getWriteTimeout(), request.writeTimeout());
    }

    @Test
    void fromConfig_carriesConfiguredTimeouts() {
        PredictionRunRequest request = PredictionRunRequest.fromConfig(PredictConfig.builder()
                .queryTimeout(Duration.ofMinutes(15))
                .dispatchTimeout(Duration.ofMinutes(90))
                .writeTimeout(Duration.ofMinutes(20))
                .durationHours(12)
                .build());

        assertEquals(12, request.getDurationHours());
        assertEquals(Duration.ofMinutes(15), request.queryTimeout());
        assertEquals(Duration.ofMinutes(90), request.dispatchTimeout());
        assertEquals(Duration.ofMinutes(20), request.writeTimeout());
    }
}
