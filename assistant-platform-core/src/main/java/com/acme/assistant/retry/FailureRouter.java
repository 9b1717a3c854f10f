package com.acme.assistant.retry;

import com.acme.assistant.core.DeadLetterEntry;
import com.acme.assistant.core.StageException;
import com.acme.assistant.core.StreamEvent;
import com.acme.assistant.core.TerminalException;
import com.acme.assistant.spi.DeadLetterStore;
import com.acme.assistant.spi.StreamConsumer;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a {@link RetryDecision} to a failed event.
 *
 * <p>A retry leaves the event unacknowledged. Dead-lettering appends to the store and only then
 * acknowledges the original; if the append fails the event stays unacknowledged and its next
 * redelivery attempts the append again.
 */
public class FailureRouter {
  private static final Logger LOG = LoggerFactory.getLogger(FailureRouter.class);

  private final RetryPolicy retryPolicy;
  private final DeadLetterStore deadLetterStore;
  private final Clock clock;

  public FailureRouter(RetryPolicy retryPolicy, DeadLetterStore deadLetterStore, Clock clock) {
    this.retryPolicy = retryPolicy;
    this.deadLetterStore = deadLetterStore;
    this.clock = clock;
  }

  public FailureResolution route(
      StreamConsumer consumer,
      StreamEvent event,
      StageException error,
      Map<String, String> sourceMetadata) {
    RetryDecision decision = retryPolicy.decide(event.id());
    if (decision instanceof RetryDecision.Retry retry) {
      LOG.warn(
          "Event {} failed in {} (attempt {}/{}), redelivery after lease expiry, backoff {}: {}",
          event.id(),
          error.getStageName(),
          retry.attempt(),
          retryPolicy.getMaxRetries(),
          retry.delay(),
          error.errorMessage());
      return FailureResolution.retry(retry);
    }

    RetryDecision.DeadLetter deadLetter = (RetryDecision.DeadLetter) decision;
    DeadLetterEntry entry =
        DeadLetterEntry.forFailure(
            event, error, deadLetter.attempt(), sourceMetadata, clock.instant());
    String dlqId;
    try {
      dlqId = deadLetterStore.append(entry);
    } catch (RuntimeException e) {
      TerminalException terminal =
          new TerminalException(event.id(), "Dead-letter write failed for event " + event.id(), e);
      LOG.error(
          "FATAL: could not dead-letter event {} after {} attempts, leaving it unacknowledged",
          event.id(),
          deadLetter.attempt(),
          terminal);
      return FailureResolution.deadLetterFailed(deadLetter);
    }

    LOG.error(
        "Event {} dead-lettered as {} after {} attempts: {}: {}",
        event.id(),
        dlqId,
        deadLetter.attempt(),
        entry.errorKind(),
        entry.errorMessage());
    consumer.ack(event.id());
    retryPolicy.clear(event.id());
    return FailureResolution.deadLettered(deadLetter, dlqId);
  }
}
