package com.cloudcost.analytics.store;

import com.cloudcost.analytics.domain.model.Alert;
import com.cloudcost.analytics.domain.model.AlertStatus;
import com.cloudcost.analytics.domain.repository.AlertRepository;
import com.cloudcost.analytics.error.PersistenceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JpaAlertStoreTest {

    @Mock
    private AlertRepository alertRepository;

    @InjectMocks
    private JpaAlertStore store;

    @Test
    @DisplayName("Should stamp the new status and failure reason")
    void shouldUpdateStatus() {
        // Given
        Alert alert = Alert.builder().id("alert-1").status(AlertStatus.PENDING).build();
        when(alertRepository.findById("alert-1")).thenReturn(Optional.of(alert));
        when(alertRepository.saveAndFlush(alert)).thenReturn(alert);

        // When
        store.updateAlertStatus("alert-1", AlertStatus.FAILED, "smtp down");

        // Then
        assertThat(alert.getStatus()).isEqualTo(AlertStatus.FAILED);
        assertThat(alert.getFailureReason()).isEqualTo("smtp down");
        assertThat(alert.getStatusUpdatedAt()).isNotNull();
    }

    @Test
    @DisplayName("Should surface a failed status write as a persistence error")
    void shouldTranslateFlushFailure() {
        // Given
        Alert alert = Alert.builder().id("alert-1").status(AlertStatus.PENDING).build();
        when(alertRepository.findById("alert-1")).thenReturn(Optional.of(alert));
        when(alertRepository.saveAndFlush(alert)).thenThrow(new DataIntegrityViolationException("constraint"));

        // When / Then
        assertThatThrownBy(() -> store.updateAlertStatus("alert-1", AlertStatus.SENT, null))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("alert-1");
    }

    @Test
    @DisplayName("Should surface a failed insert as a persistence error")
    void shouldTranslateCreateFailure() {
        // Given
        Alert alert = Alert.builder().id("alert-2").status(AlertStatus.PENDING).build();
        when(alertRepository.saveAndFlush(alert)).thenThrow(new DataIntegrityViolationException("constraint"));

        // When / Then
        assertThatThrownBy(() -> store.createAlert(alert))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("alert-2");
    }
}
