package com.acme.assistant.core;

/**
 * The queue or the network under it could not be reached. Retried at the transport layer with its
 * own short backoff; never consumes a message-level retry attempt.
 */
public class TransportException extends RuntimeException {
  public TransportException(String message) {
    super(message);
  }

  public TransportException(String message, Throwable e) {
    super(message, e);
  }
}
