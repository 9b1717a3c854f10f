package com.acme.assistant.worker.orchestrator;

/** What happened to one event in the worker loop. */
public enum ProcessingResult {
  /** Pipeline succeeded, reply published, event acknowledged. */
  PROCESSED,
  /** Pipeline failed; event left pending for redelivery. */
  RETRY_PENDING,
  /** Retries exhausted; event moved to the dead-letter store and acknowledged. */
  DEAD_LETTERED,
  /** Retries exhausted but the dead-letter write failed; event left pending. */
  DEAD_LETTER_FAILED,
  /** Pipeline succeeded but the reply could not be published; event left pending. */
  PUBLISH_FAILED,
  /** Shutdown interrupted the pipeline; event left pending, retry count untouched. */
  ABANDONED
}
