package com.acme.assistant.worker.stages;

import com.acme.assistant.conversation.ConversationEntry;
import com.acme.assistant.conversation.ConversationStore;
import com.acme.assistant.pipeline.ModelOutput;
import com.acme.assistant.pipeline.PipelineContext;
import com.acme.assistant.pipeline.PipelineStage;
import com.acme.assistant.worker.model.InboundMessage;
import com.acme.assistant.worker.model.MessageType;
import io.micronaut.core.order.Ordered;
import jakarta.inject.Singleton;
import java.util.Optional;

/**
 * Persists the inbound message keyed by event id, so a redelivered event overwrites its own entry.
 */
@Singleton
public class MessageSaverStage implements PipelineStage, Ordered {
  private final ConversationStore store;

  public MessageSaverStage(ConversationStore store) {
    this.store = store;
  }

  @Override
  public String name() {
    return "message-saver";
  }

  @Override
  public int getOrder() {
    return StageOrder.MESSAGE_SAVER;
  }

  @Override
  public Optional<ModelOutput> beforePipeline(PipelineContext context) {
    InboundMessage message = context.require(ContextKeys.INBOUND);
    String role =
        message.type() == MessageType.TOOL
            ? ConversationEntry.ROLE_TOOL
            : ConversationEntry.ROLE_USER;
    store.upsert(
        new ConversationEntry(
            context.getEventId(),
            message.userId(),
            role,
            message.content(),
            ConversationEntry.STATUS_PENDING,
            context.getEvent().enqueuedAt()));
    context.recordSideEffect(name(), "saved inbound message " + context.getEventId());
    return Optional.empty();
  }
}
