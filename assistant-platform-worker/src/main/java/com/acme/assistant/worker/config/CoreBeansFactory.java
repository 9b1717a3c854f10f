package com.acme.assistant.worker.config;

import com.acme.assistant.config.PipelineConfig;
import com.acme.assistant.config.RetryConfig;
import com.acme.assistant.config.StreamConfig;
import com.acme.assistant.config.WorkerConfig;
import com.acme.assistant.pipeline.PipelineExecutor;
import com.acme.assistant.retry.BackoffPolicy;
import com.acme.assistant.retry.FailureRouter;
import com.acme.assistant.retry.RetryPolicy;
import com.acme.assistant.spi.DeadLetterStore;
import com.acme.assistant.spi.RetryLedger;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;
import java.time.Clock;

/**
 * Factory for creating core beans with framework-specific configuration.
 *
 * <p>The core module stays free of framework dependencies; this factory binds its POJO config to
 * {@code assistant.*} properties and wires the retry and pipeline machinery.
 */
@Factory
public class CoreBeansFactory {

  /** Creates StreamConfig bean populated from application.yml assistant.stream.* properties */
  @Singleton
  @ConfigurationProperties("assistant.stream")
  public StreamConfig streamConfig() {
    return new StreamConfig();
  }

  /** Creates RetryConfig bean populated from application.yml assistant.retry.* properties */
  @Singleton
  @ConfigurationProperties("assistant.retry")
  public RetryConfig retryConfig() {
    return new RetryConfig();
  }

  @Singleton
  @ConfigurationProperties("assistant.worker")
  public WorkerConfig workerConfig() {
    return new WorkerConfig();
  }

  @Singleton
  @ConfigurationProperties("assistant.pipeline")
  public PipelineConfig pipelineConfig() {
    return new PipelineConfig();
  }

  @Singleton
  public Clock clock() {
    return Clock.systemUTC();
  }

  /** Validates stream and retry settings together before anything uses them. */
  @Singleton
  public BackoffPolicy backoffPolicy(StreamConfig streamConfig, RetryConfig retryConfig) {
    streamConfig.validate(retryConfig);
    return new BackoffPolicy(retryConfig.getBackoffSchedule());
  }

  @Singleton
  public RetryPolicy retryPolicy(
      RetryLedger retryLedger, BackoffPolicy backoffPolicy, RetryConfig retryConfig) {
    return new RetryPolicy(retryLedger, backoffPolicy, retryConfig.getMaxRetries());
  }

  @Singleton
  public FailureRouter failureRouter(
      RetryPolicy retryPolicy, DeadLetterStore deadLetterStore, Clock clock) {
    return new FailureRouter(retryPolicy, deadLetterStore, clock);
  }

  @Singleton
  public PipelineExecutor pipelineExecutor() {
    return new PipelineExecutor();
  }
}
