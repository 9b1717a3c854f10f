package com.acme.assistant.worker.config;

import com.acme.assistant.config.PipelineConfig;
import com.acme.assistant.config.RetryConfig;
import com.acme.assistant.config.StreamConfig;
import com.acme.assistant.config.WorkerConfig;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.runtime.server.event.ServerStartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration on application startup for visibility and troubleshooting.
 * Disabled in test environment.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<ServerStartupEvent> {

  private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

  private final StreamConfig streamConfig;
  private final RetryConfig retryConfig;
  private final WorkerConfig workerConfig;
  private final PipelineConfig pipelineConfig;

  @Property(name = "micronaut.server.port", defaultValue = "8080")
  private int serverPort;

  @Property(name = "redisson.address", defaultValue = "")
  private String redisAddress;

  public ConfigurationLogger(
      StreamConfig streamConfig,
      RetryConfig retryConfig,
      WorkerConfig workerConfig,
      PipelineConfig pipelineConfig) {
    this.streamConfig = streamConfig;
    this.retryConfig = retryConfig;
    this.workerConfig = workerConfig;
    this.pipelineConfig = pipelineConfig;
  }

  @Override
  public void onApplicationEvent(ServerStartupEvent event) {
    LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    LOG.info("                         EFFECTIVE CONFIGURATION                                ");
    LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    LOG.info("");

    LOG.info("━━━ Server & Broker ━━━");
    LOG.info("  Port:               {} (operator HTTP endpoints)", serverPort);
    LOG.info("  Redis:              {}", redisAddress);
    LOG.info("");

    LOG.info("━━━ Stream Configuration ━━━");
    LOG.info("  Input Stream:       {}", streamConfig.getInputStream());
    LOG.info("  Group:              {}", streamConfig.getGroup());
    LOG.info("  Consumer Name:      {} (suffixed -<n> per worker)", streamConfig.getConsumerName());
    LOG.info("  Block Timeout:      {} (max wait for a new event)", streamConfig.getBlockTimeout());
    LOG.info("  Idle Timeout:       {} (lease age before reclamation)", streamConfig.getIdleTimeout());
    LOG.info("  Reclaim Interval:   {} (periodic stale-lease sweep)", streamConfig.getReclaimInterval());
    LOG.info("  Output Stream:      {}", streamConfig.getOutputStream());
    LOG.info("  DLQ Stream:         {}", streamConfig.getDlqStream());
    LOG.info("");

    LOG.info("━━━ Retry Configuration ━━━");
    LOG.info("  Max Retries:        {}", retryConfig.getMaxRetries());
    LOG.info("  Backoff Schedule:   {}", retryConfig.getBackoffSchedule());
    LOG.info("  Ledger TTL:         {}", retryConfig.getLedgerTtl());
    LOG.info("  Sleep On Retry:     {}", retryConfig.isSleepOnRetry());
    LOG.info("");

    LOG.info("━━━ Worker Configuration ━━━");
    LOG.info("  Workers:            {} ({})", workerConfig.getConcurrency(),
        workerConfig.isEnabled() ? "ENABLED" : "DISABLED");
    LOG.info("  Shutdown Timeout:   {}", workerConfig.getShutdownTimeout());
    LOG.info("  Transport Backoff:  {} .. {}", workerConfig.getTransportBackoffInitial(),
        workerConfig.getTransportBackoffMax());
    LOG.info("  Publish Attempts:   {}", workerConfig.getPublishAttempts());
    LOG.info("");

    LOG.info("━━━ Pipeline Configuration ━━━");
    LOG.info("  History Limit:      {}", pipelineConfig.getHistoryLimit());
    LOG.info("  Memory Limit:       {} (threshold {})", pipelineConfig.getMemoryLimit(),
        pipelineConfig.getMemoryThreshold());
    LOG.info("  Summary Trigger:    {} (keep tail {})", pipelineConfig.getSummaryTrigger(),
        pipelineConfig.getSummaryKeepTail());
    LOG.info("");

    LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    LOG.info("                      APPLICATION READY FOR TRAFFIC                             ");
    LOG.info("═══════════════════════════════════════════════════════════════════════════════");
  }
}
