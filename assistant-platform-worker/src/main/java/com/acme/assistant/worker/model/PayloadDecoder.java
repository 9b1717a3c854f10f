package com.acme.assistant.worker.model;

import com.acme.assistant.core.Jsons;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.inject.Singleton;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decodes inbound payloads. Two shapes are accepted:
 *
 * <ul>
 *   <li>queue message: {@code {type, user_id, source, content: {message, metadata}, timestamp}}
 *   <li>reminder trigger: {@code {event: "reminder_triggered", assistant_id, payload: {user_id,
 *       reminder_id, payload}}}, turned into a tool message from {@code reminder_trigger}
 * </ul>
 *
 * @throws IllegalArgumentException from {@link #decode} for anything else
 */
@Singleton
public class PayloadDecoder {
  static final String REMINDER_EVENT = "reminder_triggered";
  static final String REMINDER_TOOL = "reminder_trigger";

  public InboundMessage decode(byte[] payload) {
    JsonNode root = Jsons.readTree(payload);
    if (root == null || !root.isObject()) {
      throw new IllegalArgumentException("Payload is not a JSON object");
    }
    if (REMINDER_EVENT.equals(root.path("event").asText(null))) {
      return decodeReminder(root);
    }
    return decodeQueueMessage(root);
  }

  private InboundMessage decodeQueueMessage(JsonNode root) {
    MessageType type = MessageType.fromWire(required(root, "type"));
    String userId = required(root, "user_id");
    String source = required(root, "source");
    JsonNode content = root.path("content");
    if (!content.isObject() || !content.has("message")) {
      throw new IllegalArgumentException("Missing required field: content.message");
    }
    Map<String, Object> metadata = toMap(content.path("metadata"));
    String toolName = root.path("tool_name").asText(null);
    return new InboundMessage(
        type,
        userId,
        source,
        content.path("message").asText(""),
        metadata,
        toolName,
        parseTimestamp(root.path("timestamp").asText(null)));
  }

  private InboundMessage decodeReminder(JsonNode root) {
    JsonNode event = root.path("payload");
    String userId = required(event, "user_id");
    String reminderId = required(event, "reminder_id");
    required(root, "assistant_id");
    JsonNode details = event.path("payload");
    String detailsJson = details.isMissingNode() ? "{}" : Jsons.toJson(details);
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("reminder_id", reminderId);
    return new InboundMessage(
        MessageType.TOOL,
        userId,
        InboundMessage.REMINDER_SOURCE,
        "Reminder triggered. Details: " + detailsJson,
        metadata,
        REMINDER_TOOL,
        null);
  }

  private static String required(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull() || value.asText().isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + field);
    }
    return value.asText();
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> toMap(JsonNode node) {
    if (node == null || !node.isObject()) {
      return Map.of();
    }
    Map<String, Object> map = Jsons.treeToValue(node, Map.class);
    map.values().removeIf(java.util.Objects::isNull);
    return map;
  }

  /** Accepts ISO instants and zone-less local date-times (taken as UTC). */
  static Instant parseTimestamp(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException e) {
      try {
        return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
      } catch (DateTimeParseException ignored) {
        return null;
      }
    }
  }
}
