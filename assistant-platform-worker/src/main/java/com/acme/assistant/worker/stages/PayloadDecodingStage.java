package com.acme.assistant.worker.stages;

import com.acme.assistant.pipeline.ModelOutput;
import com.acme.assistant.pipeline.PipelineContext;
import com.acme.assistant.pipeline.PipelineStage;
import com.acme.assistant.worker.model.InboundMessage;
import com.acme.assistant.worker.model.PayloadDecoder;
import io.micronaut.core.order.Ordered;
import jakarta.inject.Singleton;
import java.util.Optional;

/** Decodes the raw payload and tags the context with the originating user. */
@Singleton
public class PayloadDecodingStage implements PipelineStage, Ordered {
  private final PayloadDecoder decoder;

  public PayloadDecodingStage(PayloadDecoder decoder) {
    this.decoder = decoder;
  }

  @Override
  public String name() {
    return "payload-decoding";
  }

  @Override
  public int getOrder() {
    return StageOrder.PAYLOAD_DECODING;
  }

  @Override
  public Optional<ModelOutput> beforePipeline(PipelineContext context) {
    InboundMessage message = decoder.decode(context.getEvent().payload());
    context.put(ContextKeys.INBOUND, message);
    context.putSourceMetadata("user_id", message.userId());
    context.putSourceMetadata("source", message.source());
    context.putSourceMetadata("type", message.type().wireValue());
    return Optional.empty();
  }
}
