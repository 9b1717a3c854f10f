package com.acme.assistant.redis;

import com.acme.assistant.config.StreamConfig;
import com.acme.assistant.spi.QueueInspector;
import org.redisson.api.RStream;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;

public class RedisQueueInspector implements QueueInspector {
  private final RStream<String, byte[]> stream;
  private final String group;

  public RedisQueueInspector(RedissonClient redisson, StreamConfig config) {
    this.stream = redisson.getStream(config.getInputStream(), RedisCodecs.STREAM);
    this.group = config.getGroup();
  }

  @Override
  public long streamLength() {
    return RedisCalls.execute("stream length", stream::size);
  }

  @Override
  public long pendingCount() {
    try {
      return RedisCalls.execute("pending info", () -> stream.getPendingInfo(group).getTotal());
    } catch (RedisException e) {
      if (RedisCalls.isNoGroup(e)) {
        return 0;
      }
      throw e;
    }
  }
}
