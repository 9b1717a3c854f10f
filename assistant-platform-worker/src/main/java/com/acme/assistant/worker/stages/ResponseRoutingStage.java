package com.acme.assistant.worker.stages;

import com.acme.assistant.config.StreamConfig;
import com.acme.assistant.core.Jsons;
import com.acme.assistant.pipeline.ModelOutput;
import com.acme.assistant.pipeline.OutboundMessage;
import com.acme.assistant.pipeline.PipelineContext;
import com.acme.assistant.pipeline.PipelineStage;
import com.acme.assistant.worker.model.InboundMessage;
import com.acme.assistant.worker.model.OutboundResponse;
import io.micronaut.core.order.Ordered;
import jakarta.inject.Singleton;
import java.util.Optional;

/**
 * Chooses where the reply goes. The orchestrator publishes it only after the whole pipeline
 * succeeded.
 */
@Singleton
public class ResponseRoutingStage implements PipelineStage, Ordered {
  private final StreamConfig streamConfig;

  public ResponseRoutingStage(StreamConfig streamConfig) {
    this.streamConfig = streamConfig;
  }

  @Override
  public String name() {
    return "response-routing";
  }

  @Override
  public int getOrder() {
    return StageOrder.RESPONSE_ROUTING;
  }

  @Override
  public void afterPipeline(PipelineContext context, ModelOutput output) {
    Optional<InboundMessage> inbound = context.get(ContextKeys.INBOUND);
    if (inbound.isEmpty() || output.isBlank()) {
      return;
    }
    OutboundResponse response = OutboundResponse.success(inbound.get(), output.content());
    context.setOutbound(
        new OutboundMessage(streamConfig.getOutputStream(), Jsons.toBytes(response)));
  }
}
