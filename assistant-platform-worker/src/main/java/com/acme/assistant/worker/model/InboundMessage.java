package com.acme.assistant.worker.model;

import java.time.Instant;
import java.util.Map;

/**
 * Decoded inbound event.
 *
 * @param source where the message came from: user, cron, calendar, or reminder_trigger
 * @param toolName set for tool messages
 * @param timestamp producer timestamp, {@code null} when absent or unparseable
 */
public record InboundMessage(
    MessageType type,
    String userId,
    String source,
    String content,
    Map<String, Object> metadata,
    String toolName,
    Instant timestamp) {

  public static final String REMINDER_SOURCE = "reminder_trigger";

  public InboundMessage {
    content = content == null ? "" : content;
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public boolean isReminder() {
    return REMINDER_SOURCE.equals(source);
  }

  /** Value of the {@code type} field of the reply. Reminder replies are assistant-initiated. */
  public String responseType() {
    return isReminder() ? "assistant" : type.wireValue();
  }
}
