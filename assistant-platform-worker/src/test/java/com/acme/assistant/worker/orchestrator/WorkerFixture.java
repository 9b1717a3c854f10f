package com.acme.assistant.worker.orchestrator;

import com.acme.assistant.config.PipelineConfig;
import com.acme.assistant.config.RetryConfig;
import com.acme.assistant.config.StreamConfig;
import com.acme.assistant.config.WorkerConfig;
import com.acme.assistant.pipeline.Pipeline;
import com.acme.assistant.pipeline.PipelineExecutor;
import com.acme.assistant.pipeline.PipelineStage;
import com.acme.assistant.retry.BackoffPolicy;
import com.acme.assistant.retry.FailureRouter;
import com.acme.assistant.retry.RetryPolicy;
import com.acme.assistant.worker.metrics.StreamMetrics;
import com.acme.assistant.worker.model.PayloadDecoder;
import com.acme.assistant.worker.ports.NoOpMemoryRetriever;
import com.acme.assistant.worker.stages.ContextLoaderStage;
import com.acme.assistant.worker.stages.EmptyInputGuardStage;
import com.acme.assistant.worker.stages.FinalizerStage;
import com.acme.assistant.worker.stages.LanguageModelCallStage;
import com.acme.assistant.worker.stages.MemoryRetrievalStage;
import com.acme.assistant.worker.stages.MessageSaverStage;
import com.acme.assistant.worker.stages.PayloadDecodingStage;
import com.acme.assistant.worker.stages.ResponseRoutingStage;
import com.acme.assistant.worker.stages.ResponseSaverStage;
import com.acme.assistant.worker.stages.SummarizationStage;
import com.acme.assistant.worker.support.InMemoryConversationStore;
import com.acme.assistant.worker.support.InMemoryDeadLetterStore;
import com.acme.assistant.worker.support.InMemoryRetryLedger;
import com.acme.assistant.worker.support.InMemoryStreamBroker;
import com.acme.assistant.worker.support.RecordingPublisher;
import com.acme.assistant.worker.support.ScriptedLanguageModel;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** The default pipeline and the processor wired over in-memory adapters. */
class WorkerFixture {
  static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

  final InMemoryStreamBroker broker = new InMemoryStreamBroker();
  final InMemoryRetryLedger ledger = new InMemoryRetryLedger();
  final InMemoryDeadLetterStore deadLetters = new InMemoryDeadLetterStore(broker);
  final InMemoryConversationStore conversations = new InMemoryConversationStore();
  final RecordingPublisher publisher = new RecordingPublisher();
  final ScriptedLanguageModel model = new ScriptedLanguageModel();
  final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  final List<Duration> sleeps = new CopyOnWriteArrayList<>();

  final StreamConfig streamConfig = new StreamConfig();
  final RetryConfig retryConfig = new RetryConfig();
  final WorkerConfig workerConfig = new WorkerConfig();
  final PipelineConfig pipelineConfig = new PipelineConfig();

  final RetryPolicy retryPolicy =
      new RetryPolicy(
          ledger, new BackoffPolicy(retryConfig.getBackoffSchedule()), retryConfig.getMaxRetries());
  final StreamMetrics metrics = new StreamMetrics(registry, deadLetters);
  final EventProcessor processor;

  WorkerFixture() {
    streamConfig.setConsumerName("test");
    List<PipelineStage> stages =
        List.of(
            new PayloadDecodingStage(new PayloadDecoder()),
            new EmptyInputGuardStage(),
            new MessageSaverStage(conversations),
            new ContextLoaderStage(conversations, pipelineConfig),
            new MemoryRetrievalStage(new NoOpMemoryRetriever(), pipelineConfig),
            new SummarizationStage(model, conversations, pipelineConfig),
            new ResponseSaverStage(conversations, CLOCK),
            new ResponseRoutingStage(streamConfig),
            new FinalizerStage(conversations));
    Pipeline pipeline = new Pipeline(stages, new LanguageModelCallStage(model));
    processor =
        new EventProcessor(
            pipeline,
            new PipelineExecutor(),
            retryPolicy,
            new FailureRouter(retryPolicy, deadLetters, CLOCK),
            publisher,
            metrics,
            retryConfig,
            workerConfig,
            CLOCK,
            sleeps::add);
  }

  static byte[] humanMessage(String userId, String text) {
    String json =
        "{\"type\":\"human_message\",\"user_id\":\""
            + userId
            + "\",\"source\":\"user\",\"content\":{\"message\":\""
            + text
            + "\",\"metadata\":{\"chat_id\":7}},\"timestamp\":\"2024-05-01T11:59:00\"}";
    return json.getBytes(StandardCharsets.UTF_8);
  }

  double counter(String name) {
    return registry.find(name).counter() == null ? 0 : registry.find(name).counter().count();
  }
}
