package com.acme.assistant.conversation;

import java.util.List;
import java.util.Optional;

/** Conversation history storage used by the pipeline stages. Writes are idempotent upserts. */
public interface ConversationStore {

  /** The most recent {@code limit} entries of the user's conversation, oldest first. */
  List<ConversationEntry> recent(String userId, int limit);

  Optional<ConversationEntry> find(String userId, String entryId);

  /** Insert or replace the entry with the same id. */
  void upsert(ConversationEntry entry);

  Optional<String> summary(String userId);

  void saveSummary(String userId, String summary);
}
