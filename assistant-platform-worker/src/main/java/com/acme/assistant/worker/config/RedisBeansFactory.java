package com.acme.assistant.worker.config;

import com.acme.assistant.config.RetryConfig;
import com.acme.assistant.config.StreamConfig;
import com.acme.assistant.conversation.ConversationStore;
import com.acme.assistant.redis.RedisConversationStore;
import com.acme.assistant.redis.RedisDeadLetterStore;
import com.acme.assistant.redis.RedisQueueInspector;
import com.acme.assistant.redis.RedisRetryLedger;
import com.acme.assistant.redis.RedisStreamConsumer;
import com.acme.assistant.redis.RedisStreamPublisher;
import com.acme.assistant.spi.DeadLetterStore;
import com.acme.assistant.spi.OutboundPublisher;
import com.acme.assistant.spi.QueueInspector;
import com.acme.assistant.spi.RetryLedger;
import com.acme.assistant.worker.orchestrator.StreamConsumerProvider;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.time.Clock;
import org.redisson.api.RedissonClient;

/** Redis Streams implementations of the core SPIs. */
@Factory
@Requires(beans = RedissonClient.class)
public class RedisBeansFactory {

  @Singleton
  public RetryLedger retryLedger(RedissonClient redisson, RetryConfig retryConfig) {
    return new RedisRetryLedger(redisson, retryConfig);
  }

  @Singleton
  public OutboundPublisher outboundPublisher(RedissonClient redisson, StreamConfig streamConfig) {
    return new RedisStreamPublisher(redisson, streamConfig.getPayloadField());
  }

  @Singleton
  public DeadLetterStore deadLetterStore(
      RedissonClient redisson, StreamConfig streamConfig, OutboundPublisher publisher) {
    return new RedisDeadLetterStore(redisson, streamConfig, publisher);
  }

  @Singleton
  public QueueInspector queueInspector(RedissonClient redisson, StreamConfig streamConfig) {
    return new RedisQueueInspector(redisson, streamConfig);
  }

  @Singleton
  public ConversationStore conversationStore(RedissonClient redisson) {
    return new RedisConversationStore(redisson);
  }

  /** One stream consumer per worker, each under its own consumer name. */
  @Singleton
  public StreamConsumerProvider streamConsumerProvider(
      RedissonClient redisson, StreamConfig streamConfig, Clock clock) {
    return consumerName -> new RedisStreamConsumer(redisson, streamConfig, consumerName, clock);
  }
}
