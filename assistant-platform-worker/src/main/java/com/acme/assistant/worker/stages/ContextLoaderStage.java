package com.acme.assistant.worker.stages;

import com.acme.assistant.config.PipelineConfig;
import com.acme.assistant.conversation.ConversationEntry;
import com.acme.assistant.conversation.ConversationStore;
import com.acme.assistant.pipeline.ModelOutput;
import com.acme.assistant.pipeline.PipelineContext;
import com.acme.assistant.pipeline.PipelineStage;
import io.micronaut.core.order.Ordered;
import jakarta.inject.Singleton;
import java.util.List;
import java.util.Optional;

@Singleton
public class ContextLoaderStage implements PipelineStage, Ordered {
  private final ConversationStore store;
  private final PipelineConfig config;

  public ContextLoaderStage(ConversationStore store, PipelineConfig config) {
    this.store = store;
    this.config = config;
  }

  @Override
  public String name() {
    return "context-loader";
  }

  @Override
  public int getOrder() {
    return StageOrder.CONTEXT_LOADER;
  }

  @Override
  public Optional<ModelOutput> beforePipeline(PipelineContext context) {
    String userId = context.require(ContextKeys.INBOUND).userId();
    List<ConversationEntry> history = store.recent(userId, config.getHistoryLimit());
    context.put(ContextKeys.HISTORY, history);
    store.summary(userId).ifPresent(summary -> context.put(ContextKeys.SUMMARY, summary));
    return Optional.empty();
  }
}
