package com.acme.assistant.redis;

import com.acme.assistant.config.RetryConfig;
import com.acme.assistant.spi.RetryLedger;
import java.util.List;
import org.redisson.api.RAtomicLong;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;

/**
 * Retry counters as Redis integers at {@code <key-prefix><eventId>} with a TTL.
 *
 * <p>{@link #increment} runs INCR and PEXPIRE in one script, so a counter never exists without its
 * expiry and a failed call has either counted the attempt with its TTL or not at all.
 */
public class RedisRetryLedger implements RetryLedger {
  static final String INCREMENT_WITH_TTL =
      "local count = redis.call('INCR', KEYS[1]) "
          + "redis.call('PEXPIRE', KEYS[1], ARGV[1]) "
          + "return count";

  private final RedissonClient redisson;
  private final RetryConfig config;

  public RedisRetryLedger(RedissonClient redisson, RetryConfig config) {
    this.redisson = redisson;
    this.config = config;
  }

  @Override
  public long increment(String eventId) {
    RScript script = redisson.getScript(StringCodec.INSTANCE);
    String ttlMillis = String.valueOf(config.getLedgerTtl().toMillis());
    Long count =
        RedisCalls.execute(
            "retry increment",
            () ->
                script.eval(
                    RScript.Mode.READ_WRITE,
                    INCREMENT_WITH_TTL,
                    RScript.ReturnType.INTEGER,
                    List.<Object>of(keyFor(eventId)),
                    ttlMillis));
    return count == null ? 0 : count;
  }

  @Override
  public long get(String eventId) {
    return RedisCalls.execute("retry get", () -> counter(eventId).get());
  }

  @Override
  public void clear(String eventId) {
    RedisCalls.execute("retry clear", () -> counter(eventId).delete());
  }

  String keyFor(String eventId) {
    return config.getKeyPrefix() + eventId;
  }

  private RAtomicLong counter(String eventId) {
    return redisson.getAtomicLong(keyFor(eventId));
  }
}
