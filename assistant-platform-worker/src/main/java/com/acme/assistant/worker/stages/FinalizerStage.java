package com.acme.assistant.worker.stages;

import com.acme.assistant.conversation.ConversationEntry;
import com.acme.assistant.conversation.ConversationStore;
import com.acme.assistant.pipeline.ModelOutput;
import com.acme.assistant.pipeline.PipelineContext;
import com.acme.assistant.pipeline.PipelineStage;
import com.acme.assistant.worker.model.InboundMessage;
import io.micronaut.core.order.Ordered;
import jakarta.inject.Singleton;
import java.util.Optional;

/** Marks the inbound entry processed. Short-circuited runs never saved one, so nothing to mark. */
@Singleton
public class FinalizerStage implements PipelineStage, Ordered {
  private final ConversationStore store;

  public FinalizerStage(ConversationStore store) {
    this.store = store;
  }

  @Override
  public String name() {
    return "finalizer";
  }

  @Override
  public int getOrder() {
    return StageOrder.FINALIZER;
  }

  @Override
  public void afterPipeline(PipelineContext context, ModelOutput output) {
    if (context.isShortCircuited()) {
      context.recordSideEffect(name(), "short-circuited by " + output.producedBy());
      return;
    }
    Optional<InboundMessage> inbound = context.get(ContextKeys.INBOUND);
    if (inbound.isEmpty()) {
      return;
    }
    store
        .find(inbound.get().userId(), context.getEventId())
        .filter(entry -> !ConversationEntry.STATUS_PROCESSED.equals(entry.status()))
        .ifPresent(
            entry -> store.upsert(entry.withStatus(ConversationEntry.STATUS_PROCESSED)));
    context.recordSideEffect(name(), "marked " + context.getEventId() + " processed");
  }
}
