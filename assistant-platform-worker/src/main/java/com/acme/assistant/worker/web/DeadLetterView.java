package com.acme.assistant.worker.web;

import com.acme.assistant.core.DeadLetterEntry;
import java.util.Map;

/** JSON shape of a dead-letter entry on the operator endpoints. */
public record DeadLetterView(
    String dlqId,
    String originalEventId,
    String payload,
    String errorKind,
    String errorMessage,
    long retryCount,
    String failedAt,
    Map<String, String> metadata) {

  public static DeadLetterView of(DeadLetterEntry entry) {
    return new DeadLetterView(
        entry.dlqId(),
        entry.originalEventId(),
        entry.payloadAsString(),
        entry.errorKind(),
        entry.errorMessage(),
        entry.retryCountAtFailure(),
        entry.failedAt() == null ? null : entry.failedAt().toString(),
        entry.sourceMetadata());
  }
}
