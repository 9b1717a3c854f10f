package com.acme.assistant.core;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * An event delivered from the input stream. Immutable once written by the producer.
 *
 * @param id queue-assigned id, monotonic within a stream
 * @param payload opaque bytes, passed to the pipeline untouched
 * @param enqueuedAt when the producer appended the event
 * @param deliveryCount how many times the event has been handed to a consumer (1 on first delivery)
 */
public record StreamEvent(String id, byte[] payload, Instant enqueuedAt, long deliveryCount) {

  public StreamEvent {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(payload, "payload");
  }

  public static StreamEvent firstDelivery(String id, byte[] payload, Instant enqueuedAt) {
    return new StreamEvent(id, payload, enqueuedAt, 1);
  }

  public boolean isRedelivery() {
    return deliveryCount > 1;
  }

  public String payloadAsString() {
    return new String(payload, StandardCharsets.UTF_8);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StreamEvent other)) {
      return false;
    }
    return deliveryCount == other.deliveryCount
        && id.equals(other.id)
        && Arrays.equals(payload, other.payload)
        && Objects.equals(enqueuedAt, other.enqueuedAt);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, Arrays.hashCode(payload), enqueuedAt, deliveryCount);
  }

  @Override
  public String toString() {
    return "StreamEvent[id=" + id + ", bytes=" + payload.length + ", deliveryCount=" + deliveryCount
        + "]";
  }
}
