package com.acme.assistant.core;

/** An operator request targeted something that cannot be acted on. Never fatal to the loop. */
public class OperatorException extends RuntimeException {
  public OperatorException(String message) {
    super(message);
  }
}
