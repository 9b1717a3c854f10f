package com.acme.assistant.core;

/**
 * Writing an event to the dead-letter store failed. The original event must stay unacknowledged
 * so that it is retried on a later delivery.
 */
public class TerminalException extends RuntimeException {
  private final String eventId;

  public TerminalException(String eventId, String message, Throwable e) {
    super(message, e);
    this.eventId = eventId;
  }

  public String getEventId() {
    return eventId;
  }
}
