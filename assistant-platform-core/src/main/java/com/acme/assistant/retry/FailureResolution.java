package com.acme.assistant.retry;

/**
 * How a failed event was handled.
 *
 * @param dlqId set only when the event was dead-lettered
 */
public record FailureResolution(Kind kind, RetryDecision decision, String dlqId) {

  public enum Kind {
    /** Left unacknowledged for lease reclamation to redeliver. */
    RETRY_PENDING,
    /** Appended to the dead-letter store and acknowledged. */
    DEAD_LETTERED,
    /** The dead-letter write failed; left unacknowledged. */
    DEAD_LETTER_FAILED
  }

  public static FailureResolution retry(RetryDecision.Retry decision) {
    return new FailureResolution(Kind.RETRY_PENDING, decision, null);
  }

  public static FailureResolution deadLettered(RetryDecision.DeadLetter decision, String dlqId) {
    return new FailureResolution(Kind.DEAD_LETTERED, decision, dlqId);
  }

  public static FailureResolution deadLetterFailed(RetryDecision.DeadLetter decision) {
    return new FailureResolution(Kind.DEAD_LETTER_FAILED, decision, null);
  }
}
