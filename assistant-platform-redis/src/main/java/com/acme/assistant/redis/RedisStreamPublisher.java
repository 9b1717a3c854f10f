package com.acme.assistant.redis;

import com.acme.assistant.spi.OutboundPublisher;
import org.redisson.api.RStream;
import org.redisson.api.RedissonClient;
import org.redisson.api.StreamMessageId;
import org.redisson.api.stream.StreamAddArgs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Appends {@code {<payload-field>: <bytes>}} entries to a named stream. */
public class RedisStreamPublisher implements OutboundPublisher {
  private static final Logger LOG = LoggerFactory.getLogger(RedisStreamPublisher.class);

  private final RedissonClient redisson;
  private final String payloadField;

  public RedisStreamPublisher(RedissonClient redisson, String payloadField) {
    this.redisson = redisson;
    this.payloadField = payloadField;
  }

  @Override
  public String publish(String destination, byte[] payload) {
    RStream<String, byte[]> stream = redisson.getStream(destination, RedisCodecs.STREAM);
    StreamMessageId id =
        RedisCalls.execute(
            "publish to " + destination, () -> stream.add(StreamAddArgs.entry(payloadField, payload)));
    LOG.debug("Published {} bytes to {} as {}", payload.length, destination, id);
    return id.toString();
  }
}
