package com.acme.assistant.worker.stages;

import com.acme.assistant.pipeline.ModelOutput;
import com.acme.assistant.pipeline.PipelineContext;
import com.acme.assistant.pipeline.PipelineStage;
import io.micronaut.core.order.Ordered;
import jakarta.inject.Singleton;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Blank input needs no model call: short-circuit with an empty reply. */
@Singleton
public class EmptyInputGuardStage implements PipelineStage, Ordered {
  private static final Logger LOG = LoggerFactory.getLogger(EmptyInputGuardStage.class);

  @Override
  public String name() {
    return "empty-input-guard";
  }

  @Override
  public int getOrder() {
    return StageOrder.EMPTY_INPUT_GUARD;
  }

  @Override
  public Optional<ModelOutput> beforePipeline(PipelineContext context) {
    String content = context.require(ContextKeys.INBOUND).content();
    if (content.isBlank()) {
      LOG.info("Event {} has empty input, skipping model call", context.getEventId());
      return Optional.of(ModelOutput.empty(name()));
    }
    return Optional.empty();
  }
}
