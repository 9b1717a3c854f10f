package com.acme.assistant.retry;

import java.time.Duration;

/** What to do with an event whose pipeline run just failed. */
public sealed interface RetryDecision permits RetryDecision.Retry, RetryDecision.DeadLetter {

  /** Count of failures recorded for the event, including this one. */
  long attempt();

  /**
   * Leave the event unacknowledged. {@code delay} is informational: redelivery happens when the
   * lease goes stale.
   */
  record Retry(Duration delay, long attempt) implements RetryDecision {}

  /** The retry budget is spent; quarantine the event. */
  record DeadLetter(long attempt) implements RetryDecision {}
}
