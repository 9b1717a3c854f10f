package com.acme.assistant.conversation;

import java.time.Instant;
import java.util.Objects;

/**
 * One message of a user's conversation. The id is derived from the event that produced it so that
 * a redelivered event overwrites rather than duplicates.
 */
public record ConversationEntry(
    String id, String userId, String role, String content, String status, Instant createdAt) {

  public static final String ROLE_USER = "user";
  public static final String ROLE_TOOL = "tool";
  public static final String ROLE_ASSISTANT = "assistant";

  public static final String STATUS_PENDING = "pending";
  public static final String STATUS_PROCESSED = "processed";

  public ConversationEntry {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(role, "role");
    content = content == null ? "" : content;
    status = status == null ? STATUS_PENDING : status;
  }

  public ConversationEntry withStatus(String newStatus) {
    return new ConversationEntry(id, userId, role, content, newStatus, createdAt);
  }
}
