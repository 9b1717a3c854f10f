package com.acme.assistant.spi;

/** Read-only view of the input stream for operators. */
public interface QueueInspector {

  long streamLength();

  /** Events delivered to the consumer group but not yet acknowledged. */
  long pendingCount();
}
