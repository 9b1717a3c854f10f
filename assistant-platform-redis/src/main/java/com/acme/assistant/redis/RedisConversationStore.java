package com.acme.assistant.redis;

import com.acme.assistant.conversation.ConversationEntry;
import com.acme.assistant.conversation.ConversationStore;
import com.acme.assistant.core.Jsons;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.redisson.api.RBucket;
import org.redisson.api.RMap;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;

/**
 * Conversation history in a hash per user, {@code conversation:<userId>}, of entry id to JSON. The
 * running summary lives next to it at {@code conversation:<userId>:summary}.
 */
public class RedisConversationStore implements ConversationStore {
  private static final String KEY_PREFIX = "conversation:";
  private static final Comparator<ConversationEntry> CHRONOLOGICAL =
      Comparator.comparing(
              ConversationEntry::createdAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
          .thenComparing(ConversationEntry::id);

  private final RedissonClient redisson;

  public RedisConversationStore(RedissonClient redisson) {
    this.redisson = redisson;
  }

  @Override
  public List<ConversationEntry> recent(String userId, int limit) {
    List<ConversationEntry> all =
        RedisCalls.execute("conversation read", () -> history(userId).readAllValues()).stream()
            .map(json -> Jsons.fromJson(json, ConversationEntry.class))
            .sorted(CHRONOLOGICAL)
            .toList();
    return all.size() <= limit ? all : all.subList(all.size() - limit, all.size());
  }

  @Override
  public Optional<ConversationEntry> find(String userId, String entryId) {
    String json = RedisCalls.execute("conversation find", () -> history(userId).get(entryId));
    return Optional.ofNullable(json).map(j -> Jsons.fromJson(j, ConversationEntry.class));
  }

  @Override
  public void upsert(ConversationEntry entry) {
    String json = Jsons.toJson(entry);
    RedisCalls.execute(
        "conversation upsert", () -> history(entry.userId()).fastPut(entry.id(), json));
  }

  @Override
  public Optional<String> summary(String userId) {
    return Optional.ofNullable(RedisCalls.execute("summary read", () -> summaryBucket(userId).get()));
  }

  @Override
  public void saveSummary(String userId, String summary) {
    RedisCalls.run("summary write", () -> summaryBucket(userId).set(summary));
  }

  private RMap<String, String> history(String userId) {
    return redisson.getMap(KEY_PREFIX + userId, StringCodec.INSTANCE);
  }

  private RBucket<String> summaryBucket(String userId) {
    return redisson.getBucket(KEY_PREFIX + userId + ":summary", StringCodec.INSTANCE);
  }
}
