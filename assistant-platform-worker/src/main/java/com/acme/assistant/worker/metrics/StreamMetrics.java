package com.acme.assistant.worker.metrics;

import com.acme.assistant.core.TransportException;
import com.acme.assistant.spi.DeadLetterStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/** Processing counters and the dead-letter depth gauge, scraped through Prometheus. */
@Slf4j
@Singleton
public class StreamMetrics {
  public static final String OUTCOME_SUCCESS = "success";
  public static final String OUTCOME_FAILURE = "failure";
  public static final String OUTCOME_DEAD_LETTERED = "dead_lettered";

  private final MeterRegistry meterRegistry;
  private final DeadLetterStore deadLetterStore;

  private final Counter processedEvents;
  private final Counter retriedEvents;
  private final Counter transportErrors;
  private final AtomicLong dlqDepth = new AtomicLong(0);

  public StreamMetrics(MeterRegistry meterRegistry, DeadLetterStore deadLetterStore) {
    this.meterRegistry = meterRegistry;
    this.deadLetterStore = deadLetterStore;

    this.processedEvents =
        Counter.builder("assistant.events.processed")
            .description("Events processed successfully and acknowledged")
            .register(meterRegistry);

    this.retriedEvents =
        Counter.builder("assistant.events.retried")
            .description("Failed events left pending for redelivery")
            .register(meterRegistry);

    this.transportErrors =
        Counter.builder("assistant.transport.errors")
            .description("Redis transport failures seen by the worker loop")
            .register(meterRegistry);

    Gauge.builder("assistant.dlq.depth", dlqDepth, AtomicLong::get)
        .description("Entries currently in the dead-letter stream")
        .register(meterRegistry);
  }

  public void recordProcessed(long retryCount) {
    processedEvents.increment();
    retryCount(OUTCOME_SUCCESS).record(retryCount);
  }

  public void recordRetried() {
    retriedEvents.increment();
  }

  public void recordDeadLettered(String errorKind, long retryCount) {
    Counter.builder("assistant.events.dead_lettered")
        .description("Events moved to the dead-letter stream")
        .tag("error_kind", errorKind)
        .register(meterRegistry)
        .increment();
    retryCount(OUTCOME_DEAD_LETTERED).record(retryCount);
  }

  public void recordTransportError() {
    transportErrors.increment();
  }

  public void recordPipeline(Duration duration, String outcome) {
    Timer.builder("assistant.pipeline.duration")
        .description("Pipeline run time per event")
        .tag("outcome", outcome)
        .register(meterRegistry)
        .record(duration);
  }

  @Scheduled(
      fixedDelay = "${assistant.worker.dlq-metrics-interval:60s}",
      initialDelay = "5s")
  public void refreshDlqDepth() {
    try {
      dlqDepth.set(deadLetterStore.depth());
    } catch (TransportException e) {
      log.warn("Could not refresh DLQ depth: {}", e.getMessage());
      recordTransportError();
    }
  }

  public long currentDlqDepth() {
    return dlqDepth.get();
  }

  private DistributionSummary retryCount(String outcome) {
    return DistributionSummary.builder("assistant.events.retry_count")
        .description("Failed attempts before an event left the input stream")
        .tag("outcome", outcome)
        .register(meterRegistry);
  }
}
