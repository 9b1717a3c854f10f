package com.acme.assistant.worker.stages;

import com.acme.assistant.conversation.ConversationEntry;
import com.acme.assistant.pipeline.ModelCallStage;
import com.acme.assistant.pipeline.ModelOutput;
import com.acme.assistant.pipeline.PipelineContext;
import com.acme.assistant.worker.model.InboundMessage;
import com.acme.assistant.worker.model.MessageType;
import com.acme.assistant.worker.ports.LanguageModel;
import com.acme.assistant.worker.ports.Memory;
import com.acme.assistant.worker.ports.ModelMessage;
import com.acme.assistant.worker.ports.ModelRequest;
import jakarta.inject.Singleton;
import java.util.ArrayList;
import java.util.List;

/** Terminal model call: builds the request from everything earlier stages gathered. */
@Singleton
public class LanguageModelCallStage implements ModelCallStage {
  private final LanguageModel model;

  public LanguageModelCallStage(LanguageModel model) {
    this.model = model;
  }

  @Override
  public String name() {
    return "model-call";
  }

  @Override
  public ModelOutput call(PipelineContext context) {
    String reply = model.complete(buildRequest(context));
    return new ModelOutput(reply, name());
  }

  ModelRequest buildRequest(PipelineContext context) {
    InboundMessage message = context.require(ContextKeys.INBOUND);
    List<ConversationEntry> history = context.get(ContextKeys.HISTORY).orElse(List.of());

    List<ModelMessage> messages = new ArrayList<>(SummarizationStage.toMessages(history));
    boolean inputInHistory =
        history.stream().anyMatch(e -> e.id().equals(context.getEventId()));
    if (!inputInHistory) {
      messages.add(
          new ModelMessage(
              message.type() == MessageType.TOOL
                  ? ConversationEntry.ROLE_TOOL
                  : ConversationEntry.ROLE_USER,
              message.content()));
    }
    List<String> memories =
        context.get(ContextKeys.MEMORIES).orElse(List.of()).stream().map(Memory::text).toList();
    return new ModelRequest(
        message.userId(),
        null,
        context.get(ContextKeys.SUMMARY).orElse(null),
        memories,
        messages);
  }
}
