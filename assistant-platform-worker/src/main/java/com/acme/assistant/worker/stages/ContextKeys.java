package com.acme.assistant.worker.stages;

import com.acme.assistant.conversation.ConversationEntry;
import com.acme.assistant.pipeline.ContextKey;
import com.acme.assistant.worker.model.InboundMessage;
import com.acme.assistant.worker.ports.Memory;
import java.util.List;

/** Values the default stages exchange through the pipeline context. */
public final class ContextKeys {
  public static final ContextKey<InboundMessage> INBOUND = ContextKey.of("inbound");
  public static final ContextKey<List<ConversationEntry>> HISTORY = ContextKey.of("history");
  public static final ContextKey<List<Memory>> MEMORIES = ContextKey.of("memories");
  public static final ContextKey<String> SUMMARY = ContextKey.of("summary");

  private ContextKeys() {}
}
