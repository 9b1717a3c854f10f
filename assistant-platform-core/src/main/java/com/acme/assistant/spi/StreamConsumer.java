package com.acme.assistant.spi;

import com.acme.assistant.core.StreamEvent;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * A named member of a consumer group on the input stream. Owns the leases of the events it has been
 * handed until they are acknowledged or reclaimed by another member.
 *
 * <p>Transport failures surface as {@link com.acme.assistant.core.TransportException}.
 */
public interface StreamConsumer {

  String consumerName();

  /** Create the consumer group (and the stream) when missing. Idempotent. */
  void ensureGroup();

  /**
   * Wait, bounded by the configured block timeout, for the next event for this consumer: a never
   * delivered one, or one whose stale lease was reclaimed for it.
   *
   * @return the event, or empty when the wait timed out
   */
  Optional<StreamEvent> read();

  /**
   * Remove the event from the group's pending set. Must be the last action taken on a processed
   * event.
   *
   * @return {@code false} when nothing was pending under that id (already acknowledged, or
   *     reclaimed and acknowledged elsewhere); that case is a no-op, not an error
   */
  boolean ack(String eventId);

  /**
   * Take over every event leased longer than {@code idleThreshold} without acknowledgment.
   *
   * @return the reclaimed events with their incremented delivery counts
   */
  List<StreamEvent> reclaimStale(Duration idleThreshold);
}
