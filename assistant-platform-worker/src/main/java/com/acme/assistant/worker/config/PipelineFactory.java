package com.acme.assistant.worker.config;

import com.acme.assistant.pipeline.ModelCallStage;
import com.acme.assistant.pipeline.Pipeline;
import com.acme.assistant.pipeline.PipelineStage;
import io.micronaut.context.annotation.Factory;
import io.micronaut.core.order.OrderUtil;
import jakarta.inject.Singleton;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers every {@link PipelineStage} bean, ordered by {@link io.micronaut.core.order.Ordered},
 * around the single {@link ModelCallStage} bean. Adding a stage means adding a bean.
 */
@Factory
public class PipelineFactory {
  private static final Logger LOG = LoggerFactory.getLogger(PipelineFactory.class);

  @Singleton
  public Pipeline pipeline(List<PipelineStage> stages, ModelCallStage modelCall) {
    List<PipelineStage> ordered = new ArrayList<>(stages);
    OrderUtil.sort(ordered);
    Pipeline pipeline = new Pipeline(ordered, modelCall);
    LOG.info("Pipeline stages: {} -> {}", pipeline.stageNames(), modelCall.name());
    return pipeline;
  }
}
