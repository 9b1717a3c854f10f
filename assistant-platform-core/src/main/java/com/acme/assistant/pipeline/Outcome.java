package com.acme.assistant.pipeline;

import com.acme.assistant.core.StageException;

/** Result of a pipeline run; the only channel from the executor back to its caller. */
public sealed interface Outcome permits Outcome.Success, Outcome.Failure {

  static Outcome success(PipelineContext context) {
    return new Success(context);
  }

  static Outcome failure(StageException error) {
    return new Failure(error);
  }

  record Success(PipelineContext context) implements Outcome {}

  record Failure(StageException error) implements Outcome {}
}
