package com.acme.assistant.core;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * A permanently failed event plus the context it failed in. Immutable; its only exits from the
 * dead-letter store are an explicit requeue or an explicit delete.
 *
 * @param dlqId id assigned by the store on append, {@code null} before that
 */
public record DeadLetterEntry(
    String dlqId,
    String originalEventId,
    byte[] payload,
    String errorKind,
    String errorMessage,
    long retryCountAtFailure,
    Instant failedAt,
    Map<String, String> sourceMetadata) {

  public static final int MAX_ERROR_MESSAGE_LENGTH = 500;
  public static final String UNKNOWN_ERROR_KIND = "unknown";

  public DeadLetterEntry {
    Objects.requireNonNull(originalEventId, "originalEventId");
    Objects.requireNonNull(payload, "payload");
    errorKind = errorKind == null || errorKind.isBlank() ? UNKNOWN_ERROR_KIND : errorKind;
    errorMessage = truncate(errorMessage);
    sourceMetadata = sourceMetadata == null ? Map.of() : Map.copyOf(sourceMetadata);
  }

  /** Build an entry for an event that exhausted its retries. */
  public static DeadLetterEntry forFailure(
      StreamEvent event,
      StageException error,
      long retryCount,
      Map<String, String> sourceMetadata,
      Instant failedAt) {
    return new DeadLetterEntry(
        null,
        event.id(),
        event.payload(),
        error.errorKind(),
        error.errorMessage(),
        retryCount,
        failedAt,
        sourceMetadata);
  }

  public DeadLetterEntry withDlqId(String id) {
    return new DeadLetterEntry(
        id,
        originalEventId,
        payload,
        errorKind,
        errorMessage,
        retryCountAtFailure,
        failedAt,
        sourceMetadata);
  }

  public String payloadAsString() {
    return new String(payload, StandardCharsets.UTF_8);
  }

  private static String truncate(String message) {
    if (message == null) {
      return "";
    }
    return message.length() > MAX_ERROR_MESSAGE_LENGTH
        ? message.substring(0, MAX_ERROR_MESSAGE_LENGTH)
        : message;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DeadLetterEntry other)) {
      return false;
    }
    return retryCountAtFailure == other.retryCountAtFailure
        && Objects.equals(dlqId, other.dlqId)
        && originalEventId.equals(other.originalEventId)
        && Arrays.equals(payload, other.payload)
        && errorKind.equals(other.errorKind)
        && errorMessage.equals(other.errorMessage)
        && Objects.equals(failedAt, other.failedAt)
        && sourceMetadata.equals(other.sourceMetadata);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        dlqId,
        originalEventId,
        Arrays.hashCode(payload),
        errorKind,
        errorMessage,
        retryCountAtFailure,
        failedAt,
        sourceMetadata);
  }

  @Override
  public String toString() {
    return "DeadLetterEntry[dlqId=" + dlqId + ", originalEventId=" + originalEventId
        + ", errorKind=" + errorKind + ", retryCountAtFailure=" + retryCountAtFailure + "]";
  }
}
