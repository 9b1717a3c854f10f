package com.acme.assistant.pipeline;

/** Points in a pipeline run at which stages are invoked, in execution order. */
public enum PipelineHook {
  BEFORE_PIPELINE,
  BEFORE_MODEL_CALL,
  MODEL_CALL,
  AFTER_MODEL_CALL,
  AFTER_PIPELINE
}
