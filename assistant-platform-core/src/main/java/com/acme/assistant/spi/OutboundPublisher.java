package com.acme.assistant.spi;

/** Appends a payload to a named outbound stream. */
public interface OutboundPublisher {

  /**
   * @return id assigned to the published message
   * @throws com.acme.assistant.core.TransportException when the stream cannot be reached
   */
  String publish(String destination, byte[] payload);
}
