package com.acme.assistant.worker.stages;

import com.acme.assistant.config.PipelineConfig;
import com.acme.assistant.pipeline.ModelOutput;
import com.acme.assistant.pipeline.PipelineContext;
import com.acme.assistant.pipeline.PipelineStage;
import com.acme.assistant.worker.model.InboundMessage;
import com.acme.assistant.worker.ports.Memory;
import com.acme.assistant.worker.ports.MemoryRetriever;
import io.micronaut.core.order.Ordered;
import jakarta.inject.Singleton;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/** Retrieves relevant long-term memories. Retrieval is optional: failures degrade to none. */
@Slf4j
@Singleton
public class MemoryRetrievalStage implements PipelineStage, Ordered {
  private final MemoryRetriever retriever;
  private final PipelineConfig config;

  public MemoryRetrievalStage(MemoryRetriever retriever, PipelineConfig config) {
    this.retriever = retriever;
    this.config = config;
  }

  @Override
  public String name() {
    return "memory-retrieval";
  }

  @Override
  public int getOrder() {
    return StageOrder.MEMORY_RETRIEVAL;
  }

  @Override
  public Optional<ModelOutput> beforeModelCall(PipelineContext context) {
    InboundMessage message = context.require(ContextKeys.INBOUND);
    List<Memory> memories;
    try {
      memories =
          retriever.retrieve(
              message.userId(),
              message.content(),
              config.getMemoryLimit(),
              config.getMemoryThreshold());
    } catch (RuntimeException e) {
      log.warn(
          "Memory retrieval failed for user {}, continuing without memories: {}",
          message.userId(),
          e.getMessage());
      memories = List.of();
    }
    context.put(ContextKeys.MEMORIES, memories);
    return Optional.empty();
  }
}
