package com.acme.assistant.pipeline;

import java.util.Objects;

/** A payload a stage wants published once the event has been processed successfully. */
public record OutboundMessage(String destination, byte[] payload) {

  public OutboundMessage {
    Objects.requireNonNull(destination, "destination");
    Objects.requireNonNull(payload, "payload");
  }

  @Override
  public boolean equals(Object o) {
    return this == o
        || (o instanceof OutboundMessage other
            && destination.equals(other.destination)
            && java.util.Arrays.equals(payload, other.payload));
  }

  @Override
  public int hashCode() {
    return 31 * destination.hashCode() + java.util.Arrays.hashCode(payload);
  }

  @Override
  public String toString() {
    return "OutboundMessage[destination=" + destination + ", bytes=" + payload.length + "]";
  }
}
