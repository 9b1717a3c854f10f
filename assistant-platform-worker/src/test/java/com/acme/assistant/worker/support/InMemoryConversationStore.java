package com.acme.assistant.worker.support;

import com.acme.assistant.conversation.ConversationEntry;
import com.acme.assistant.conversation.ConversationStore;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Keeps entries in insertion order; an upsert of an existing id keeps its position. */
public class InMemoryConversationStore implements ConversationStore {
  private final Map<String, LinkedHashMap<String, ConversationEntry>> conversations =
      new HashMap<>();
  private final Map<String, String> summaries = new HashMap<>();

  @Override
  public synchronized List<ConversationEntry> recent(String userId, int limit) {
    List<ConversationEntry> all = all(userId);
    return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
  }

  @Override
  public synchronized Optional<ConversationEntry> find(String userId, String entryId) {
    return Optional.ofNullable(conversations.getOrDefault(userId, new LinkedHashMap<>()).get(entryId));
  }

  @Override
  public synchronized void upsert(ConversationEntry entry) {
    conversations.computeIfAbsent(entry.userId(), k -> new LinkedHashMap<>()).put(entry.id(), entry);
  }

  @Override
  public synchronized Optional<String> summary(String userId) {
    return Optional.ofNullable(summaries.get(userId));
  }

  @Override
  public synchronized void saveSummary(String userId, String summary) {
    summaries.put(userId, summary);
  }

  public synchronized List<ConversationEntry> all(String userId) {
    return new ArrayList<>(conversations.getOrDefault(userId, new LinkedHashMap<>()).values());
  }
}
