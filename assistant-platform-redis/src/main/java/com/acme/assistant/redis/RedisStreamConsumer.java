package com.acme.assistant.redis;

import com.acme.assistant.config.StreamConfig;
import com.acme.assistant.core.StreamEvent;
import com.acme.assistant.spi.StreamConsumer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.redisson.api.AutoClaimResult;
import org.redisson.api.PendingEntry;
import org.redisson.api.RStream;
import org.redisson.api.RedissonClient;
import org.redisson.api.StreamMessageId;
import org.redisson.api.stream.StreamCreateGroupArgs;
import org.redisson.api.stream.StreamReadGroupArgs;
import org.redisson.client.RedisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumer-group member on a Redis stream.
 *
 * <p>{@link #read()} returns one event per call: a stale lease claimed by the interval sweep when
 * {@code reclaim-interval} has elapsed, otherwise a never-delivered event ({@code XREADGROUP >}),
 * otherwise a stale lease claimed after the block timeout. Stale leases are claimed one at a time
 * so a claimed event is processed while its new lease is fresh. The {@code XAUTOCLAIM} cursor is
 * kept between calls, and a sweep stays due until it has walked the whole pending list.
 *
 * <p>Not thread-safe: each worker owns its own instance.
 */
public class RedisStreamConsumer implements StreamConsumer {
  private static final Logger LOG = LoggerFactory.getLogger(RedisStreamConsumer.class);
  private static final StreamMessageId SCAN_START = new StreamMessageId(0, 0);

  private final RStream<String, byte[]> stream;
  private final StreamConfig config;
  private final String consumerName;
  private final Clock clock;
  private StreamMessageId claimCursor = SCAN_START;
  private Instant lastSweep;

  public RedisStreamConsumer(
      RedissonClient redisson, StreamConfig config, String consumerName, Clock clock) {
    this.stream = redisson.getStream(config.getInputStream(), RedisCodecs.STREAM);
    this.config = config;
    this.consumerName = consumerName;
    this.clock = clock;
    this.lastSweep = clock.instant();
  }

  @Override
  public String consumerName() {
    return consumerName;
  }

  @Override
  public void ensureGroup() {
    try {
      RedisCalls.run(
          "create group",
          () ->
              stream.createGroup(
                  StreamCreateGroupArgs.name(config.getGroup())
                      .id(StreamMessageId.ALL)
                      .makeStream()));
      LOG.info(
          "Created consumer group {} on stream {}", config.getGroup(), config.getInputStream());
    } catch (RedisException e) {
      if (!RedisCalls.isBusyGroup(e)) {
        throw e;
      }
      LOG.debug("Consumer group {} already exists", config.getGroup());
    }
  }

  @Override
  public Optional<StreamEvent> read() {
    if (sweepDue()) {
      Optional<StreamEvent> stale = claimNextStale();
      if (stale.isPresent()) {
        return stale;
      }
    }

    Optional<StreamEvent> fresh = readNew();
    if (fresh.isPresent()) {
      return fresh;
    }
    return claimNextStale();
  }

  @Override
  public boolean ack(String eventId) {
    long acked =
        RedisCalls.execute(
            "ack", () -> stream.ack(config.getGroup(), StreamIds.parse(eventId)));
    if (acked == 0) {
      LOG.info(
          "Ack of {} by {} was a no-op: already acknowledged or reclaimed elsewhere",
          eventId,
          consumerName);
      return false;
    }
    return true;
  }

  /**
   * Walks the whole pending list in batches of {@code reclaim-batch-size} and takes over every
   * stale lease. The caller owns all returned leases at once and must settle them before they go
   * stale again.
   */
  @Override
  public List<StreamEvent> reclaimStale(Duration idleThreshold) {
    List<StreamEvent> events = new ArrayList<>();
    StreamMessageId cursor = SCAN_START;
    do {
      AutoClaimResult<String, byte[]> result =
          autoClaim(idleThreshold, cursor, config.getReclaimBatchSize());
      if (result == null) {
        return events;
      }
      events.addAll(toEvents(result));
      cursor = nextCursor(result);
    } while (!isScanStart(cursor));
    if (!events.isEmpty()) {
      LOG.info(
          "{} reclaimed {} stale event(s) idle over {}",
          consumerName,
          events.size(),
          idleThreshold);
    }
    return events;
  }

  /** Claims at most one stale lease, resuming the scan where the previous claim stopped. */
  private Optional<StreamEvent> claimNextStale() {
    AutoClaimResult<String, byte[]> result = autoClaim(config.getIdleTimeout(), claimCursor, 1);
    if (result == null) {
      return Optional.empty();
    }
    claimCursor = nextCursor(result);
    List<StreamEvent> claimed = toEvents(result);
    if (claimed.isEmpty() && isScanStart(claimCursor)) {
      lastSweep = clock.instant();
      return Optional.empty();
    }
    claimed.forEach(
        event ->
            LOG.info(
                "{} reclaimed stale event {} (delivery {})",
                consumerName,
                event.id(),
                event.deliveryCount()));
    return claimed.stream().findFirst();
  }

  /** Returns {@code null} when the group was missing and has been recreated. */
  private AutoClaimResult<String, byte[]> autoClaim(
      Duration idleThreshold, StreamMessageId start, int count) {
    try {
      return RedisCalls.execute(
          "autoclaim",
          () ->
              stream.autoClaim(
                  config.getGroup(),
                  consumerName,
                  idleThreshold.toMillis(),
                  TimeUnit.MILLISECONDS,
                  start,
                  count));
    } catch (RedisException e) {
      if (RedisCalls.isNoGroup(e)) {
        recoverMissingGroup();
        return null;
      }
      throw e;
    }
  }

  private List<StreamEvent> toEvents(AutoClaimResult<String, byte[]> result) {
    List<StreamEvent> events = new ArrayList<>();
    for (Map.Entry<StreamMessageId, Map<String, byte[]>> entry : result.getMessages().entrySet()) {
      StreamMessageId id = entry.getKey();
      toEvent(id, entry.getValue(), deliveryCount(id)).ifPresent(events::add);
    }
    return events;
  }

  private static StreamMessageId nextCursor(AutoClaimResult<String, byte[]> result) {
    return result.getNextId() == null ? SCAN_START : result.getNextId();
  }

  private static boolean isScanStart(StreamMessageId id) {
    return id.getId0() == 0 && id.getId1() == 0;
  }

  private Optional<StreamEvent> readNew() {
    Map<StreamMessageId, Map<String, byte[]>> messages;
    try {
      messages =
          RedisCalls.execute(
              "read",
              () ->
                  stream.readGroup(
                      config.getGroup(),
                      consumerName,
                      StreamReadGroupArgs.neverDelivered()
                          .count(1)
                          .timeout(config.getBlockTimeout())));
    } catch (RedisException e) {
      if (RedisCalls.isNoGroup(e)) {
        recoverMissingGroup();
        return Optional.empty();
      }
      throw e;
    }
    if (messages == null || messages.isEmpty()) {
      return Optional.empty();
    }
    for (Map.Entry<StreamMessageId, Map<String, byte[]>> entry : messages.entrySet()) {
      Optional<StreamEvent> event = toEvent(entry.getKey(), entry.getValue(), 1);
      if (event.isPresent()) {
        return event;
      }
    }
    return Optional.empty();
  }

  private boolean sweepDue() {
    return !clock.instant().isBefore(lastSweep.plus(config.getReclaimInterval()));
  }

  private long deliveryCount(StreamMessageId id) {
    List<PendingEntry> pending =
        RedisCalls.execute(
            "pending", () -> stream.listPending(config.getGroup(), id, id, 1));
    if (pending == null || pending.isEmpty()) {
      return 1;
    }
    return Math.max(1, pending.get(0).getLastTimeDelivered());
  }

  /** Entries without a payload field are acknowledged and skipped. */
  private Optional<StreamEvent> toEvent(
      StreamMessageId id, Map<String, byte[]> fields, long deliveryCount) {
    byte[] payload = fields == null ? null : fields.get(config.getPayloadField());
    if (payload == null) {
      LOG.warn(
          "Entry {} on {} has no '{}' field, acknowledging and skipping",
          id,
          config.getInputStream(),
          config.getPayloadField());
      RedisCalls.execute("ack", () -> stream.ack(config.getGroup(), id));
      return Optional.empty();
    }
    return Optional.of(
        new StreamEvent(id.toString(), payload, StreamIds.timestampOf(id), deliveryCount));
  }

  private void recoverMissingGroup() {
    LOG.warn(
        "Consumer group {} missing on {}, recreating", config.getGroup(), config.getInputStream());
    ensureGroup();
  }
}
