package com.acme.assistant.redis;

import java.time.Instant;
import java.util.Optional;
import org.redisson.api.StreamMessageId;

/** Conversions between textual stream ids ({@code <millis>-<sequence>}) and Redisson ids. */
final class StreamIds {

  private StreamIds() {}

  /**
   * @throws IllegalArgumentException when {@code id} is not of the form {@code <millis>-<seq>}
   */
  static StreamMessageId parse(String id) {
    return tryParse(id)
        .orElseThrow(() -> new IllegalArgumentException("Invalid stream id: " + id));
  }

  static Optional<StreamMessageId> tryParse(String id) {
    if (id == null) {
      return Optional.empty();
    }
    int dash = id.indexOf('-');
    if (dash <= 0 || dash == id.length() - 1) {
      return Optional.empty();
    }
    try {
      long millis = Long.parseLong(id.substring(0, dash));
      long sequence = Long.parseLong(id.substring(dash + 1));
      if (millis < 0 || sequence < 0) {
        return Optional.empty();
      }
      return Optional.of(new StreamMessageId(millis, sequence));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  /** The smallest id strictly greater than {@code id}. */
  static StreamMessageId next(StreamMessageId id) {
    return new StreamMessageId(id.getId0(), id.getId1() + 1);
  }

  /** Stream ids carry their append time in the millisecond part. */
  static Instant timestampOf(StreamMessageId id) {
    return Instant.ofEpochMilli(id.getId0());
  }
}
