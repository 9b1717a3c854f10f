package com.acme.assistant.worker.model;

import java.util.Arrays;

/** Kind of inbound queue message, with its wire value. */
public enum MessageType {
  HUMAN("human_message"),
  TOOL("tool_message");

  private final String wireValue;

  MessageType(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }

  public static MessageType fromWire(String value) {
    return Arrays.stream(values())
        .filter(t -> t.wireValue.equals(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown message type: " + value));
  }
}
