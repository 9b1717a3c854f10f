package com.acme.assistant.worker.orchestrator;

import com.acme.assistant.config.StreamConfig;
import com.acme.assistant.config.WorkerConfig;
import com.acme.assistant.core.StreamEvent;
import com.acme.assistant.core.TransportException;
import com.acme.assistant.spi.StreamConsumer;
import com.acme.assistant.worker.metrics.StreamMetrics;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the worker loops: each worker owns one named consumer in the group and repeats
 * read, process, settle until shutdown.
 *
 * <p>A worker never dies on an event. Transport errors back off and retry, anything else is logged
 * and the loop moves on; the unacknowledged event comes back through lease reclamation.
 */
@Singleton
@Requires(property = "assistant.worker.enabled", value = "true", defaultValue = "true")
public class Orchestrator implements ApplicationEventListener<StartupEvent>, AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(Orchestrator.class);

  private final StreamConsumerProvider consumerProvider;
  private final EventProcessor processor;
  private final StreamConfig streamConfig;
  private final WorkerConfig workerConfig;
  private final StreamMetrics metrics;
  private final Sleeper sleeper;
  private final List<StreamConsumer> consumers = new ArrayList<>();

  private volatile boolean running;
  private ExecutorService workers;

  @Inject
  public Orchestrator(
      StreamConsumerProvider consumerProvider,
      EventProcessor processor,
      StreamConfig streamConfig,
      WorkerConfig workerConfig,
      StreamMetrics metrics) {
    this(consumerProvider, processor, streamConfig, workerConfig, metrics, Sleeper.THREAD);
  }

  Orchestrator(
      StreamConsumerProvider consumerProvider,
      EventProcessor processor,
      StreamConfig streamConfig,
      WorkerConfig workerConfig,
      StreamMetrics metrics,
      Sleeper sleeper) {
    this.consumerProvider = consumerProvider;
    this.processor = processor;
    this.streamConfig = streamConfig;
    this.workerConfig = workerConfig;
    this.metrics = metrics;
    this.sleeper = sleeper;
  }

  @Override
  public void onApplicationEvent(StartupEvent event) {
    start();
  }

  /**
   * Creates the consumer group if needed and starts {@code concurrency} workers. A group that
   * cannot be created is fatal.
   */
  public synchronized void start() {
    if (running) {
      return;
    }
    consumers.clear();
    int concurrency = Math.max(1, workerConfig.getConcurrency());
    for (int i = 0; i < concurrency; i++) {
      consumers.add(consumerProvider.create(streamConfig.consumerNameFor(i)));
    }
    consumers.get(0).ensureGroup();

    AtomicInteger threadIndex = new AtomicInteger();
    workers =
        Executors.newFixedThreadPool(
            concurrency,
            r -> {
              Thread t = new Thread(r, "assistant-worker-" + threadIndex.getAndIncrement());
              t.setDaemon(false);
              return t;
            });
    running = true;
    for (StreamConsumer consumer : consumers) {
      workers.submit(() -> runLoop(consumer));
    }
    LOG.info(
        "Started {} worker(s) on stream {} group {}",
        concurrency,
        streamConfig.getInputStream(),
        streamConfig.getGroup());
  }

  void runLoop(StreamConsumer consumer) {
    LOG.info("Worker {} polling {}", consumer.consumerName(), streamConfig.getInputStream());
    int transportFailures = 0;
    while (running && !Thread.currentThread().isInterrupted()) {
      try {
        Optional<StreamEvent> event = consumer.read();
        if (event.isPresent()) {
          processor.process(consumer, event.get(), () -> !running);
        }
        transportFailures = 0;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      } catch (TransportException e) {
        transportFailures++;
        metrics.recordTransportError();
        Duration backoff = workerConfig.transportBackoff(transportFailures);
        LOG.warn(
            "Worker {} lost the broker ({} in a row), retrying in {}: {}",
            consumer.consumerName(),
            transportFailures,
            backoff,
            e.getMessage());
        if (!pause(backoff)) {
          break;
        }
      } catch (RuntimeException e) {
        LOG.error("Worker {} hit an unexpected error, continuing", consumer.consumerName(), e);
      }
    }
    LOG.info("Worker {} stopped", consumer.consumerName());
  }

  private boolean pause(Duration duration) {
    try {
      sleeper.sleep(duration);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  public boolean isRunning() {
    return running;
  }

  List<StreamConsumer> consumers() {
    return List.copyOf(consumers);
  }

  /**
   * Stops reading, lets in-flight events finish within the shutdown timeout, then interrupts
   * whatever is left. Interrupted events stay pending and are reclaimed later.
   */
  @PreDestroy
  @Override
  public synchronized void close() {
    if (!running) {
      return;
    }
    running = false;
    workers.shutdown();
    Duration timeout = workerConfig.getShutdownTimeout();
    try {
      if (!workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        LOG.warn("Workers did not finish within {}, interrupting", timeout);
        workers.shutdownNow();
        if (!workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
          LOG.error("Workers ignored the interrupt for another {}", timeout);
        }
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
    LOG.info("Orchestrator stopped");
  }
}
