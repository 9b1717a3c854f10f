package com.acme.assistant.worker.stages;

import com.acme.assistant.conversation.ConversationEntry;
import com.acme.assistant.conversation.ConversationStore;
import com.acme.assistant.pipeline.ModelOutput;
import com.acme.assistant.pipeline.PipelineContext;
import com.acme.assistant.pipeline.PipelineStage;
import io.micronaut.core.order.Ordered;
import jakarta.inject.Singleton;
import java.time.Clock;

/** Persists the model's reply under {@code <eventId>:response}. */
@Singleton
public class ResponseSaverStage implements PipelineStage, Ordered {
  static final String RESPONSE_SUFFIX = ":response";

  private final ConversationStore store;
  private final Clock clock;

  public ResponseSaverStage(ConversationStore store, Clock clock) {
    this.store = store;
    this.clock = clock;
  }

  @Override
  public String name() {
    return "response-saver";
  }

  @Override
  public int getOrder() {
    return StageOrder.RESPONSE_SAVER;
  }

  @Override
  public void afterModelCall(PipelineContext context, ModelOutput output) {
    if (output.isBlank()) {
      return;
    }
    String userId = context.require(ContextKeys.INBOUND).userId();
    String id = context.getEventId() + RESPONSE_SUFFIX;
    store.upsert(
        new ConversationEntry(
            id,
            userId,
            ConversationEntry.ROLE_ASSISTANT,
            output.content(),
            ConversationEntry.STATUS_PROCESSED,
            clock.instant()));
    context.recordSideEffect(name(), "saved response " + id);
  }
}
