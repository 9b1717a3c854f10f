package com.acme.assistant.redis;

import com.acme.assistant.core.TransportException;
import java.util.function.Supplier;
import org.redisson.client.RedisConnectionException;
import org.redisson.client.RedisException;
import org.redisson.client.RedisTimeoutException;

/** Maps Redisson connectivity failures onto {@link TransportException}. */
final class RedisCalls {

  private RedisCalls() {}

  static <T> T execute(String operation, Supplier<T> call) {
    try {
      return call.get();
    } catch (RedisConnectionException | RedisTimeoutException e) {
      throw new TransportException("Redis unavailable during " + operation, e);
    }
  }

  static void run(String operation, Runnable call) {
    execute(
        operation,
        () -> {
          call.run();
          return null;
        });
  }

  static boolean isNoGroup(RedisException e) {
    return e.getMessage() != null && e.getMessage().contains("NOGROUP");
  }

  static boolean isBusyGroup(RedisException e) {
    return e.getMessage() != null && e.getMessage().contains("BUSYGROUP");
  }
}
