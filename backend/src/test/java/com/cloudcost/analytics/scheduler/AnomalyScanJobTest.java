package com.cloudcost.analytics.scheduler;

import com.cloudcost.analytics.anomaly.AnomalyDetectionRequest;
import com.cloudcost.analytics.anomaly.Sensitivity;
import com.cloudcost.analytics.error.NoDataException;
import com.cloudcost.analytics.pipeline.CostAnalyticsPipeline;
import com.cloudcost.analytics.pipeline.PipelineRunSummary;
import com.cloudcost.analytics.store.BillingStore;
import com.cloudcost.analytics.store.TimeWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnomalyScanJobTest {

    @Mock
    private CostAnalyticsPipeline pipeline;

    @Mock
    private BillingStore billingStore;

    private AnomalyScanJob job;

    @BeforeEach
    void setUp() {
        job = new AnomalyScanJob(pipeline, billingStore,
                Clock.fixed(Instant.parse("2024-02-01T03:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should scan every active user and keep going after failures")
    void shouldScanAllUsers() {
        // Given
        when(billingStore.findActiveUsers(any(TimeWindow.class))).thenReturn(List.of("a", "b", "c"));
        when(pipeline.run(any(AnomalyDetectionRequest.class)))
                .thenThrow(new NoDataException("no data for a"))
                .thenThrow(new IllegalStateException("boom"))
                .thenReturn(new PipelineRunSummary("c", List.of(), List.of(), Map.of()));

        // When
        job.scanAllUsers();

        // Then
        ArgumentCaptor<AnomalyDetectionRequest> captor = ArgumentCaptor.forClass(AnomalyDetectionRequest.class);
        verify(pipeline, times(3)).run(captor.capture());
        assertThat(captor.getAllValues())
                .extracting(AnomalyDetectionRequest::userId)
                .containsExactly("a", "b", "c");
        assertThat(captor.getAllValues())
                .allSatisfy(r -> assertThat(r.sensitivity()).isEqualTo(Sensitivity.MEDIUM));
    }

    @Test
    @DisplayName("Should look back over the configured window")
    void shouldUseLookbackWindow() {
        when(billingStore.findActiveUsers(any(TimeWindow.class))).thenReturn(List.of());

        job.scanAllUsers();

        ArgumentCaptor<TimeWindow> captor = ArgumentCaptor.forClass(TimeWindow.class);
        verify(billingStore).findActiveUsers(captor.capture());
        assertThat(captor.getValue().from()).isEqualTo(Instant.parse("2024-01-02T03:00:00Z"));
        assertThat(captor.getValue().to()).isEqualTo(Instant.parse("2024-02-01T03:00:00Z"));
    }
}
