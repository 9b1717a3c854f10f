package com.acme.assistant.worker.stages;

import com.acme.assistant.config.PipelineConfig;
import com.acme.assistant.conversation.ConversationEntry;
import com.acme.assistant.conversation.ConversationStore;
import com.acme.assistant.pipeline.ModelOutput;
import com.acme.assistant.pipeline.PipelineContext;
import com.acme.assistant.pipeline.PipelineStage;
import com.acme.assistant.worker.ports.LanguageModel;
import com.acme.assistant.worker.ports.ModelMessage;
import io.micronaut.core.order.Ordered;
import jakarta.inject.Singleton;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the prompt bounded. Once loaded history exceeds {@code summary-trigger} entries, everything
 * but the last {@code summary-keep-tail} is folded into the stored summary and dropped from the
 * context.
 */
@Slf4j
@Singleton
public class SummarizationStage implements PipelineStage, Ordered {
  private final LanguageModel model;
  private final ConversationStore store;
  private final PipelineConfig config;

  public SummarizationStage(LanguageModel model, ConversationStore store, PipelineConfig config) {
    this.model = model;
    this.store = store;
    this.config = config;
  }

  @Override
  public String name() {
    return "summarization";
  }

  @Override
  public int getOrder() {
    return StageOrder.SUMMARIZATION;
  }

  @Override
  public Optional<ModelOutput> beforeModelCall(PipelineContext context) {
    List<ConversationEntry> history = context.get(ContextKeys.HISTORY).orElse(List.of());
    if (history.size() <= config.getSummaryTrigger()) {
      return Optional.empty();
    }
    String userId = context.require(ContextKeys.INBOUND).userId();
    int keep = Math.min(Math.max(config.getSummaryKeepTail(), 1), history.size());
    List<ConversationEntry> head = history.subList(0, history.size() - keep);
    List<ConversationEntry> tail = List.copyOf(history.subList(history.size() - keep, history.size()));

    String previous = context.get(ContextKeys.SUMMARY).orElse(null);
    String summary = model.summarize(userId, previous, toMessages(head));
    if (summary != null && !summary.isBlank()) {
      store.saveSummary(userId, summary);
      context.put(ContextKeys.SUMMARY, summary);
      context.recordSideEffect(name(), "summarized " + head.size() + " entries");
    }
    context.put(ContextKeys.HISTORY, tail);
    log.debug("Trimmed history of user {} from {} to {} entries", userId, history.size(), keep);
    return Optional.empty();
  }

  static List<ModelMessage> toMessages(List<ConversationEntry> entries) {
    return entries.stream().map(e -> new ModelMessage(e.role(), e.content())).toList();
  }
}
