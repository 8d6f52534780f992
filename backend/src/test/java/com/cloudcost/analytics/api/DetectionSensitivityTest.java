package com.cloudcost.analytics.api;

import com.cloudcost.analytics.anomaly.AnomalyDetectionRequest;
import com.cloudcost.analytics.anomaly.Sensitivity;
import com.cloudcost.analytics.pipeline.CostAnalyticsPipeline;
import com.cloudcost.analytics.pipeline.PipelineRunSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DetectionSensitivityTest {

    private static final String USER = "user-1";

    @Mock
    private CostAnalyticsPipeline pipeline;

    @Captor
    private ArgumentCaptor<AnomalyDetectionRequest> requestCaptor;

    private CostAnalyticsController controller;

    @BeforeEach
    void setUp() {
        controller = new CostAnalyticsController(pipeline, null, null, null, null, Clock.systemUTC());
        ReflectionTestUtils.setField(controller, "defaultSensitivity", "high");
        when(pipeline.run(any(AnomalyDetectionRequest.class)))
                .thenReturn(new PipelineRunSummary(USER, List.of(), List.of(), Map.of()));
    }

    @Test
    @DisplayName("Should fall back to the configured sensitivity when the request has none")
    void shouldUseConfiguredDefault() {
        // When
        controller.detectAnomalies(USER, null);

        // Then
        verify(pipeline).run(requestCaptor.capture());
        assertThat(requestCaptor.getValue().sensitivity()).isEqualTo(Sensitivity.HIGH);
    }

    @Test
    @DisplayName("Should prefer the sensitivity sent by the caller")
    void shouldPreferRequestedSensitivity() {
        // Given
        DetectAnomaliesRequest body = new DetectAnomaliesRequest(null, null, null, "low", null);

        // When
        controller.detectAnomalies(USER, body);

        // Then
        verify(pipeline).run(requestCaptor.capture());
        assertThat(requestCaptor.getValue().sensitivity()).isEqualTo(Sensitivity.LOW);
    }
}
