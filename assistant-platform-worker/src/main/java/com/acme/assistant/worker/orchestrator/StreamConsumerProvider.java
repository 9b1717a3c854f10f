package com.acme.assistant.worker.orchestrator;

import com.acme.assistant.spi.StreamConsumer;

/** Creates the stream consumer a worker pulls from. */
@FunctionalInterface
public interface StreamConsumerProvider {

  StreamConsumer create(String consumerName);
}
