package com.acme.assistant.worker.orchestrator;

import com.acme.assistant.config.RetryConfig;
import com.acme.assistant.config.WorkerConfig;
import com.acme.assistant.core.StageException;
import com.acme.assistant.core.StreamEvent;
import com.acme.assistant.core.TransportException;
import com.acme.assistant.pipeline.OutboundMessage;
import com.acme.assistant.pipeline.Outcome;
import com.acme.assistant.pipeline.Pipeline;
import com.acme.assistant.pipeline.PipelineContext;
import com.acme.assistant.pipeline.PipelineExecutor;
import com.acme.assistant.retry.FailureResolution;
import com.acme.assistant.retry.FailureRouter;
import com.acme.assistant.retry.RetryDecision;
import com.acme.assistant.retry.RetryPolicy;
import com.acme.assistant.spi.OutboundPublisher;
import com.acme.assistant.spi.StreamConsumer;
import com.acme.assistant.worker.metrics.StreamMetrics;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Takes one event from read to its final state.
 *
 * <p>Success: publish the reply (if any), clear the retry record, then acknowledge. Failure: hand
 * the stage error to the {@link FailureRouter}. Transport errors from the ledger, the store or the
 * acknowledgment propagate to the worker loop; the event then stays pending.
 *
 * <p>A failure caused by shutdown (the worker was interrupted or told to stop) is not a processing
 * failure: the event is left pending with its retry count untouched.
 */
@Singleton
public class EventProcessor {
  private static final Logger LOG = LoggerFactory.getLogger(EventProcessor.class);
  static final String MDC_EVENT_ID = "eventId";
  static final String MDC_CONSUMER = "consumer";

  private final Pipeline pipeline;
  private final PipelineExecutor executor;
  private final RetryPolicy retryPolicy;
  private final FailureRouter failureRouter;
  private final OutboundPublisher publisher;
  private final StreamMetrics metrics;
  private final RetryConfig retryConfig;
  private final WorkerConfig workerConfig;
  private final Clock clock;
  private final Sleeper sleeper;

  @Inject
  public EventProcessor(
      Pipeline pipeline,
      PipelineExecutor executor,
      RetryPolicy retryPolicy,
      FailureRouter failureRouter,
      OutboundPublisher publisher,
      StreamMetrics metrics,
      RetryConfig retryConfig,
      WorkerConfig workerConfig,
      Clock clock) {
    this(
        pipeline,
        executor,
        retryPolicy,
        failureRouter,
        publisher,
        metrics,
        retryConfig,
        workerConfig,
        clock,
        Sleeper.THREAD);
  }

  EventProcessor(
      Pipeline pipeline,
      PipelineExecutor executor,
      RetryPolicy retryPolicy,
      FailureRouter failureRouter,
      OutboundPublisher publisher,
      StreamMetrics metrics,
      RetryConfig retryConfig,
      WorkerConfig workerConfig,
      Clock clock,
      Sleeper sleeper) {
    this.pipeline = pipeline;
    this.executor = executor;
    this.retryPolicy = retryPolicy;
    this.failureRouter = failureRouter;
    this.publisher = publisher;
    this.metrics = metrics;
    this.retryConfig = retryConfig;
    this.workerConfig = workerConfig;
    this.clock = clock;
    this.sleeper = sleeper;
  }

  public ProcessingResult process(StreamConsumer consumer, StreamEvent event)
      throws InterruptedException {
    return process(consumer, event, () -> false);
  }

  /**
   * Processes one event; {@code stopping} reports whether the owning worker is shutting down.
   */
  public ProcessingResult process(
      StreamConsumer consumer, StreamEvent event, BooleanSupplier stopping)
      throws InterruptedException {
    MDC.put(MDC_EVENT_ID, event.id());
    MDC.put(MDC_CONSUMER, consumer.consumerName());
    try {
      LOG.info(
          "Received event {} ({} bytes, delivery {})",
          event.id(),
          event.payload().length,
          event.deliveryCount());
      PipelineContext context = new PipelineContext(event, clock);
      long start = System.nanoTime();
      Outcome outcome = executor.run(pipeline, context);
      Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

      if (outcome instanceof Outcome.Success success) {
        metrics.recordPipeline(elapsed, StreamMetrics.OUTCOME_SUCCESS);
        return onSuccess(consumer, event, success.context());
      }
      StageException error = ((Outcome.Failure) outcome).error();
      if (abandonedByShutdown(error, stopping)) {
        LOG.warn(
            "Event {} interrupted by shutdown in stage {}, leaving it pending",
            event.id(),
            error.getStageName());
        return ProcessingResult.ABANDONED;
      }
      metrics.recordPipeline(elapsed, StreamMetrics.OUTCOME_FAILURE);
      return onFailure(consumer, event, error, context);
    } finally {
      MDC.remove(MDC_EVENT_ID);
      MDC.remove(MDC_CONSUMER);
    }
  }

  private static boolean abandonedByShutdown(StageException error, BooleanSupplier stopping) {
    if (Thread.currentThread().isInterrupted() || stopping.getAsBoolean()) {
      return true;
    }
    for (Throwable t = error.getCause(); t != null; t = t.getCause()) {
      if (t instanceof InterruptedException) {
        return true;
      }
    }
    return false;
  }

  private ProcessingResult onSuccess(
      StreamConsumer consumer, StreamEvent event, PipelineContext context)
      throws InterruptedException {
    Optional<OutboundMessage> outbound = context.getOutbound();
    if (outbound.isPresent() && !publish(outbound.get())) {
      LOG.warn(
          "Event {} processed but its reply could not be published, leaving it pending",
          event.id());
      return ProcessingResult.PUBLISH_FAILED;
    }
    long retryCount = event.isRedelivery() ? retryPolicy.currentCount(event.id()) : 0;
    retryPolicy.recordSuccess(event.id());
    consumer.ack(event.id());
    metrics.recordProcessed(retryCount);
    LOG.info(
        "Processed event {} ({} side effects)", event.id(), context.getSideEffects().size());
    return ProcessingResult.PROCESSED;
  }

  private ProcessingResult onFailure(
      StreamConsumer consumer, StreamEvent event, StageException error, PipelineContext context)
      throws InterruptedException {
    FailureResolution resolution =
        failureRouter.route(consumer, event, error, context.getSourceMetadata());
    switch (resolution.kind()) {
      case RETRY_PENDING -> {
        metrics.recordRetried();
        if (retryConfig.isSleepOnRetry()
            && resolution.decision() instanceof RetryDecision.Retry retry) {
          sleeper.sleep(retry.delay());
        }
        return ProcessingResult.RETRY_PENDING;
      }
      case DEAD_LETTERED -> {
        metrics.recordDeadLettered(error.errorKind(), resolution.decision().attempt());
        return ProcessingResult.DEAD_LETTERED;
      }
      default -> {
        return ProcessingResult.DEAD_LETTER_FAILED;
      }
    }
  }

  /** Publishes with the transport backoff. Returns {@code false} once every attempt failed. */
  private boolean publish(OutboundMessage message) throws InterruptedException {
    int attempts = Math.max(1, workerConfig.getPublishAttempts());
    for (int attempt = 1; attempt <= attempts; attempt++) {
      try {
        publisher.publish(message.destination(), message.payload());
        return true;
      } catch (TransportException e) {
        metrics.recordTransportError();
        if (attempt == attempts) {
          LOG.warn(
              "Publishing to {} failed after {} attempts: {}",
              message.destination(),
              attempts,
              e.getMessage());
          return false;
        }
        Duration backoff = workerConfig.transportBackoff(attempt);
        LOG.warn(
            "Publishing to {} failed (attempt {}/{}), retrying in {}: {}",
            message.destination(),
            attempt,
            attempts,
            backoff,
            e.getMessage());
        sleeper.sleep(backoff);
      }
    }
    return false;
  }
}
