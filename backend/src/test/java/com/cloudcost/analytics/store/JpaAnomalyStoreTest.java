package com.cloudcost.analytics.store;

import com.cloudcost.analytics.domain.model.Anomaly;
import com.cloudcost.analytics.domain.model.AnomalySeverity;
import com.cloudcost.analytics.domain.model.AnomalyStatus;
import com.cloudcost.analytics.domain.model.CloudProvider;
import com.cloudcost.analytics.domain.model.RootCause;
import com.cloudcost.analytics.domain.repository.AnomalyRepository;
import com.cloudcost.analytics.error.PersistenceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JpaAnomalyStoreTest {

    private static final String USER = "user-1";
    private static final LocalDateTime FIRST_SEEN = LocalDateTime.of(2024, 1, 7, 6, 0);

    @Mock
    private AnomalyRepository anomalyRepository;

    @InjectMocks
    private JpaAnomalyStore store;

    private static Anomaly anomaly(String id, AnomalyStatus status, LocalDateTime createdAt) {
        return Anomaly.builder()
                .id(id)
                .userId(USER)
                .detectedFor(Instant.parse("2024-01-07T00:00:00Z"))
                .provider(CloudProvider.AWS)
                .service("EC2")
                .project("checkout")
                .actualCost(200)
                .expectedCost(100)
                .deviation(1.0)
                .severity(AnomalySeverity.HIGH)
                .rootCauseCategory(RootCause.MISCONFIGURATION)
                .status(status)
                .createdAt(createdAt)
                .build();
    }

    @Nested
    @DisplayName("Saving a detection batch")
    class SaveTests {

        @Test
        @DisplayName("Should keep the stored status and first detection time of a known anomaly")
        void shouldPreserveResolutionState() {
            // Given
            Anomaly stored = anomaly("known", AnomalyStatus.RESOLVED, FIRST_SEEN);
            Anomaly redetected = anomaly("known", AnomalyStatus.ACTIVE, FIRST_SEEN.plusDays(1));
            Anomaly fresh = anomaly("fresh", AnomalyStatus.ACTIVE, FIRST_SEEN.plusDays(1));
            when(anomalyRepository.findAllById(List.of("known", "fresh"))).thenReturn(List.of(stored));

            // When
            List<Anomaly> created = store.saveAnomalies(USER, List.of(redetected, fresh));

            // Then
            assertThat(created).containsExactly(fresh);
            assertThat(redetected.getStatus()).isEqualTo(AnomalyStatus.RESOLVED);
            assertThat(redetected.getCreatedAt()).isEqualTo(FIRST_SEEN);
            assertThat(fresh.getStatus()).isEqualTo(AnomalyStatus.ACTIVE);
            verify(anomalyRepository).saveAll(List.of(redetected, fresh));
            verify(anomalyRepository).flush();
        }

        @Test
        @DisplayName("Should not touch the repository for an empty batch")
        void shouldSkipEmptyBatch() {
            assertThat(store.saveAnomalies(USER, List.of())).isEmpty();
            verifyNoInteractions(anomalyRepository);
        }

        @Test
        @DisplayName("Should translate write failures into a persistence error")
        void shouldTranslateWriteFailure() {
            // Given
            Anomaly fresh = anomaly("fresh", AnomalyStatus.ACTIVE, FIRST_SEEN);
            when(anomalyRepository.findAllById(List.of("fresh"))).thenReturn(List.of());
            when(anomalyRepository.saveAll(anyList())).thenThrow(new DataIntegrityViolationException("duplicate"));

            // When / Then
            assertThatThrownBy(() -> store.saveAnomalies(USER, List.of(fresh)))
                    .isInstanceOf(PersistenceException.class)
                    .hasMessageContaining(USER);
            verify(anomalyRepository, never()).flush();
        }
    }
}
