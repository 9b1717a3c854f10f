package com.acme.assistant.spi;

/**
 * Durable per-event attempt counter shared by every consumer process. Records expire on their own
 * so abandoned counters do not accumulate.
 */
public interface RetryLedger {

  /** Atomically increment the event's count and refresh its expiry. Returns the new count. */
  long increment(String eventId);

  /** Current count, 0 when no record exists. */
  long get(String eventId);

  /** Remove the record. Idempotent. */
  void clear(String eventId);
}
