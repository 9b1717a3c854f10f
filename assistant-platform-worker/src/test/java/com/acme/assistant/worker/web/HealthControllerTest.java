package com.acme.assistant.worker.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.acme.assistant.worker.orchestrator.Orchestrator;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("HealthController Tests")
class HealthControllerTest {

  @Mock private Orchestrator orchestrator;

  @Test
  @DisplayName("should be UP while the workers run")
  void testUpWhileRunning() {
    // Given
    when(orchestrator.isRunning()).thenReturn(true);

    // When
    HttpResponse<Map<String, String>> response = new HealthController(orchestrator).health();

    // Then
    assertThat((Object) response.status()).isEqualTo(HttpStatus.OK);
    assertThat(response.body()).containsEntry("status", "UP").containsEntry("workers", "running");
  }

  @Test
  @DisplayName("should be DOWN with 503 once the workers have stopped")
  void testDownWhenStopped() {
    // Given
    when(orchestrator.isRunning()).thenReturn(false);

    // When
    HttpResponse<Map<String, String>> response = new HealthController(orchestrator).health();

    // Then
    assertThat((Object) response.status()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    assertThat(response.body()).containsEntry("status", "DOWN").containsEntry("workers", "stopped");
  }

  @Test
  @DisplayName("should stay UP when the workers are disabled on this instance")
  void testUpWhenDisabled() {
    // When
    HttpResponse<Map<String, String>> response = new HealthController(null).health();

    // Then
    assertThat((Object) response.status()).isEqualTo(HttpStatus.OK);
    assertThat(response.body()).containsEntry("workers", "disabled");
  }
}
