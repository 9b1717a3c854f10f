package com.acme.assistant.core;

import com.acme.assistant.pipeline.PipelineHook;

/** A pipeline stage (or the terminal model call) failed while processing an event. */
public class StageException extends RuntimeException {
  private final String stageName;
  private final PipelineHook hook;

  public StageException(String stageName, PipelineHook hook, String message) {
    super(message);
    this.stageName = stageName;
    this.hook = hook;
  }

  public StageException(String stageName, PipelineHook hook, String message, Throwable cause) {
    super(message, cause);
    this.stageName = stageName;
    this.hook = hook;
  }

  public String getStageName() {
    return stageName;
  }

  public PipelineHook getHook() {
    return hook;
  }

  /**
   * The error kind recorded on a dead-letter entry: simple class name of the underlying stage
   * error, or of this exception when a stage raised it directly.
   */
  public String errorKind() {
    Throwable cause = getCause();
    return cause != null ? cause.getClass().getSimpleName() : getClass().getSimpleName();
  }

  /** Message of the underlying error, falling back to this exception's own message. */
  public String errorMessage() {
    Throwable cause = getCause();
    if (cause != null && cause.getMessage() != null) {
      return cause.getMessage();
    }
    return getMessage() != null ? getMessage() : "";
  }
}
