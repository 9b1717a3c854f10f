package com.acme.assistant.retry;

import com.acme.assistant.spi.RetryLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Retry-or-quarantine decision backed by the shared retry ledger. */
public class RetryPolicy {
  private static final Logger LOG = LoggerFactory.getLogger(RetryPolicy.class);

  private final RetryLedger ledger;
  private final BackoffPolicy backoff;
  private final int maxRetries;

  public RetryPolicy(RetryLedger ledger, BackoffPolicy backoff, int maxRetries) {
    if (maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be >= 1, was " + maxRetries);
    }
    this.ledger = ledger;
    this.backoff = backoff;
    this.maxRetries = maxRetries;
  }

  /**
   * Record one more failure of the event and decide what happens to it. A count past the maximum
   * (a failed dead-letter write being retried) still reports the maximum as the triggering attempt.
   */
  public RetryDecision decide(String eventId) {
    long count = ledger.increment(eventId);
    if (count >= maxRetries) {
      LOG.debug("Event {} reached {} of {} attempts", eventId, count, maxRetries);
      return new RetryDecision.DeadLetter(maxRetries);
    }
    return new RetryDecision.Retry(backoff.delayFor(count), count);
  }

  /** Forget the event's failures. Idempotent. */
  public void recordSuccess(String eventId) {
    clear(eventId);
  }

  /** Drop the event's record once it has left the input stream for good. */
  public void clear(String eventId) {
    ledger.clear(eventId);
  }

  public long currentCount(String eventId) {
    return ledger.get(eventId);
  }

  public int getMaxRetries() {
    return maxRetries;
  }
}
