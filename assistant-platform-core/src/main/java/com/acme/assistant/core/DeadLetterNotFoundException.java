package com.acme.assistant.core;

public class DeadLetterNotFoundException extends OperatorException {
  private final String dlqId;

  public DeadLetterNotFoundException(String dlqId) {
    super("Message not found in DLQ: " + dlqId);
    this.dlqId = dlqId;
  }

  public String getDlqId() {
    return dlqId;
  }
}
