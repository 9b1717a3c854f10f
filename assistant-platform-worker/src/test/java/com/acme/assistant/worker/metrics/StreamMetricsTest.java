package com.acme.assistant.worker.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.acme.assistant.core.TransportException;
import com.acme.assistant.spi.DeadLetterStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("StreamMetrics Tests")
class StreamMetricsTest {

  @Mock private DeadLetterStore deadLetterStore;

  private SimpleMeterRegistry registry;
  private StreamMetrics metrics;

  @BeforeEach
  void setup() {
    registry = new SimpleMeterRegistry();
    metrics = new StreamMetrics(registry, deadLetterStore);
  }

  @Test
  @DisplayName("should count processed events and record their retry count")
  void testRecordProcessed() {
    metrics.recordProcessed(0);
    metrics.recordProcessed(2);

    assertThat(registry.get("assistant.events.processed").counter().count()).isEqualTo(2.0);
    assertThat(
            registry
                .get("assistant.events.retry_count")
                .tag("outcome", StreamMetrics.OUTCOME_SUCCESS)
                .summary()
                .totalAmount())
        .isEqualTo(2.0);
  }

  @Test
  @DisplayName("should tag dead-lettered events with their error kind")
  void testRecordDeadLettered() {
    metrics.recordDeadLettered("IllegalStateException", 3);
    metrics.recordDeadLettered("IllegalStateException", 3);
    metrics.recordDeadLettered("IllegalArgumentException", 3);

    assertThat(
            registry
                .get("assistant.events.dead_lettered")
                .tag("error_kind", "IllegalStateException")
                .counter()
                .count())
        .isEqualTo(2.0);
    assertThat(
            registry
                .get("assistant.events.retry_count")
                .tag("outcome", StreamMetrics.OUTCOME_DEAD_LETTERED)
                .summary()
                .count())
        .isEqualTo(3);
  }

  @Test
  @DisplayName("should time pipeline runs per outcome")
  void testRecordPipeline() {
    metrics.recordPipeline(Duration.ofMillis(40), StreamMetrics.OUTCOME_SUCCESS);
    metrics.recordPipeline(Duration.ofMillis(10), StreamMetrics.OUTCOME_FAILURE);

    assertThat(
            registry
                .get("assistant.pipeline.duration")
                .tag("outcome", StreamMetrics.OUTCOME_FAILURE)
                .timer()
                .count())
        .isEqualTo(1);
  }

  @Test
  @DisplayName("should refresh the DLQ depth gauge from the store")
  void testRefreshDlqDepth() {
    when(deadLetterStore.depth()).thenReturn(7L);

    metrics.refreshDlqDepth();

    assertThat(metrics.currentDlqDepth()).isEqualTo(7);
    assertThat(registry.get("assistant.dlq.depth").gauge().value()).isEqualTo(7.0);
  }

  @Test
  @DisplayName("should keep the last depth and count a transport error when Redis is down")
  void testRefreshDlqDepthTransportError() {
    when(deadLetterStore.depth()).thenReturn(4L).thenThrow(new TransportException("down"));

    metrics.refreshDlqDepth();
    metrics.refreshDlqDepth();

    assertThat(metrics.currentDlqDepth()).isEqualTo(4);
    assertThat(registry.get("assistant.transport.errors").counter().count()).isEqualTo(1.0);
  }
}
