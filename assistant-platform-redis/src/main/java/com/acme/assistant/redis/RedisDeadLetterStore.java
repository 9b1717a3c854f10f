package com.acme.assistant.redis;

import com.acme.assistant.config.StreamConfig;
import com.acme.assistant.core.DeadLetterEntry;
import com.acme.assistant.core.DeadLetterFilter;
import com.acme.assistant.core.DeadLetterNotFoundException;
import com.acme.assistant.core.DeadLetterStats;
import com.acme.assistant.spi.DeadLetterStore;
import com.acme.assistant.spi.OutboundPublisher;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Predicate;
import org.redisson.api.RMap;
import org.redisson.api.RStream;
import org.redisson.api.RedissonClient;
import org.redisson.api.StreamMessageId;
import org.redisson.api.stream.StreamAddArgs;
import org.redisson.client.codec.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dead-letter store on the Redis stream {@code <input-stream><dlq-suffix>}; the entry id is the
 * stream id. A side hash maps original event ids to entry ids so that appending the same event
 * twice (a redelivery racing an earlier successful append) yields one entry.
 */
public class RedisDeadLetterStore implements DeadLetterStore {
  private static final Logger LOG = LoggerFactory.getLogger(RedisDeadLetterStore.class);

  static final String FIELD_PAYLOAD = "payload";
  static final String FIELD_ORIGINAL_ID = "original_message_id";
  static final String FIELD_ERROR_TYPE = "error_type";
  static final String FIELD_ERROR_MESSAGE = "error_message";
  static final String FIELD_RETRY_COUNT = "retry_count";
  static final String FIELD_FAILED_AT = "failed_at";
  static final String META_PREFIX = "meta.";

  private static final int PAGE_SIZE = 100;

  private final RStream<String, byte[]> stream;
  private final RMap<String, String> index;
  private final StreamConfig config;
  private final OutboundPublisher publisher;

  public RedisDeadLetterStore(
      RedissonClient redisson, StreamConfig config, OutboundPublisher publisher) {
    this.stream = redisson.getStream(config.getDlqStream(), RedisCodecs.STREAM);
    this.index = redisson.getMap(config.getDlqStream() + ":index", StringCodec.INSTANCE);
    this.config = config;
    this.publisher = publisher;
  }

  @Override
  public String append(DeadLetterEntry entry) {
    String existing = RedisCalls.execute("dlq index get", () -> index.get(entry.originalEventId()));
    if (existing != null && find(existing).isPresent()) {
      LOG.info(
          "Event {} already dead-lettered as {}, not appending again",
          entry.originalEventId(),
          existing);
      return existing;
    }
    StreamMessageId id =
        RedisCalls.execute("dlq append", () -> stream.add(StreamAddArgs.entries(encode(entry))));
    RedisCalls.execute("dlq index put", () -> index.fastPut(entry.originalEventId(), id.toString()));
    return id.toString();
  }

  @Override
  public List<DeadLetterEntry> list(DeadLetterFilter filter, int limit) {
    List<DeadLetterEntry> result = new ArrayList<>();
    scan(
        entry -> {
          if (filter.matches(entry)) {
            result.add(entry);
          }
          return result.size() < limit;
        });
    return result;
  }

  @Override
  public Optional<DeadLetterEntry> get(String dlqId) {
    return find(dlqId);
  }

  @Override
  public String requeue(String dlqId) {
    DeadLetterEntry entry = find(dlqId).orElseThrow(() -> new DeadLetterNotFoundException(dlqId));
    String newEventId = publisher.publish(config.getInputStream(), entry.payload());
    remove(entry);
    LOG.info(
        "Requeued dead-letter {} (original {}) as new event {}",
        dlqId,
        entry.originalEventId(),
        newEventId);
    return newEventId;
  }

  @Override
  public void delete(String dlqId) {
    DeadLetterEntry entry = find(dlqId).orElseThrow(() -> new DeadLetterNotFoundException(dlqId));
    remove(entry);
    LOG.info("Deleted dead-letter {} (original {})", dlqId, entry.originalEventId());
  }

  @Override
  public long purge(DeadLetterFilter filter) {
    if (filter.matchesAll()) {
      long count = depth();
      RedisCalls.execute("dlq purge", stream::delete);
      RedisCalls.execute("dlq index purge", index::delete);
      LOG.warn("Purged all {} dead-letter entries from {}", count, config.getDlqStream());
      return count;
    }
    List<DeadLetterEntry> matching = new ArrayList<>();
    scan(
        entry -> {
          if (filter.matches(entry)) {
            matching.add(entry);
          }
          return true;
        });
    matching.forEach(this::remove);
    LOG.warn(
        "Purged {} dead-letter entries from {} matching {}",
        matching.size(),
        config.getDlqStream(),
        filter);
    return matching.size();
  }

  @Override
  public DeadLetterStats stats() {
    Map<String, Long> byKind = new TreeMap<>();
    Instant[] range = new Instant[2];
    long[] total = new long[1];
    scan(
        entry -> {
          total[0]++;
          byKind.merge(entry.errorKind(), 1L, Long::sum);
          Instant at = entry.failedAt();
          if (range[0] == null || at.isBefore(range[0])) {
            range[0] = at;
          }
          if (range[1] == null || at.isAfter(range[1])) {
            range[1] = at;
          }
          return true;
        });
    return new DeadLetterStats(config.getDlqStream(), total[0], byKind, range[0], range[1]);
  }

  @Override
  public long depth() {
    return RedisCalls.execute("dlq depth", stream::size);
  }

  private Optional<DeadLetterEntry> find(String dlqId) {
    Optional<StreamMessageId> id = StreamIds.tryParse(dlqId);
    if (id.isEmpty()) {
      return Optional.empty();
    }
    Map<StreamMessageId, Map<String, byte[]>> found =
        RedisCalls.execute("dlq get", () -> stream.range(1, id.get(), id.get()));
    if (found == null || found.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(decode(id.get(), found.get(id.get())));
  }

  private void remove(DeadLetterEntry entry) {
    StreamMessageId id = StreamIds.parse(entry.dlqId());
    RedisCalls.execute("dlq remove", () -> stream.remove(id));
    RedisCalls.execute("dlq index remove", () -> index.remove(entry.originalEventId(), entry.dlqId()));
  }

  /** Visits entries in id order until {@code visitor} returns {@code false}. */
  private void scan(Predicate<DeadLetterEntry> visitor) {
    StreamMessageId start = StreamMessageId.MIN;
    while (true) {
      StreamMessageId from = start;
      Map<StreamMessageId, Map<String, byte[]>> page =
          RedisCalls.execute("dlq scan", () -> stream.range(PAGE_SIZE, from, StreamMessageId.MAX));
      if (page == null || page.isEmpty()) {
        return;
      }
      StreamMessageId last = null;
      for (Map.Entry<StreamMessageId, Map<String, byte[]>> e : page.entrySet()) {
        last = e.getKey();
        if (!visitor.test(decode(e.getKey(), e.getValue()))) {
          return;
        }
      }
      if (page.size() < PAGE_SIZE) {
        return;
      }
      start = StreamIds.next(last);
    }
  }

  static Map<String, byte[]> encode(DeadLetterEntry entry) {
    Map<String, byte[]> fields = new LinkedHashMap<>();
    fields.put(FIELD_PAYLOAD, entry.payload());
    fields.put(FIELD_ORIGINAL_ID, utf8(entry.originalEventId()));
    fields.put(FIELD_ERROR_TYPE, utf8(entry.errorKind()));
    fields.put(FIELD_ERROR_MESSAGE, utf8(entry.errorMessage()));
    fields.put(FIELD_RETRY_COUNT, utf8(Long.toString(entry.retryCountAtFailure())));
    fields.put(FIELD_FAILED_AT, utf8(entry.failedAt().toString()));
    entry.sourceMetadata().forEach((k, v) -> fields.put(META_PREFIX + k, utf8(v)));
    return fields;
  }

  static DeadLetterEntry decode(StreamMessageId id, Map<String, byte[]> fields) {
    Map<String, String> metadata = new LinkedHashMap<>();
    fields.forEach(
        (k, v) -> {
          if (k.startsWith(META_PREFIX)) {
            metadata.put(k.substring(META_PREFIX.length()), text(v));
          }
        });
    byte[] payload = fields.get(FIELD_PAYLOAD);
    return new DeadLetterEntry(
        id.toString(),
        Optional.ofNullable(text(fields.get(FIELD_ORIGINAL_ID))).orElse(""),
        payload == null ? new byte[0] : payload,
        text(fields.get(FIELD_ERROR_TYPE)),
        text(fields.get(FIELD_ERROR_MESSAGE)),
        parseCount(text(fields.get(FIELD_RETRY_COUNT))),
        parseInstant(text(fields.get(FIELD_FAILED_AT)), id),
        metadata);
  }

  private static long parseCount(String value) {
    if (value == null) {
      return 0;
    }
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      return 0;
    }
  }

  private static Instant parseInstant(String value, StreamMessageId id) {
    if (value != null) {
      try {
        return Instant.parse(value);
      } catch (DateTimeParseException e) {
        LOG.debug("Unparseable failed_at '{}' on {}, using the entry timestamp", value, id);
      }
    }
    return StreamIds.timestampOf(id);
  }

  private static byte[] utf8(String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }

  private static String text(byte[] value) {
    return value == null ? null : new String(value, StandardCharsets.UTF_8);
  }
}
