package com.acme.assistant.pipeline;

import java.util.Optional;

/**
 * A named unit of pipeline work. Every hook defaults to a no-op, so a stage overrides only the
 * points it participates in. Stages are registered once and invoked for every event; they must not
 * keep per-event state in fields.
 *
 * <p>Side effects on external systems must be safe to repeat: the same event can be processed again
 * after a failure further down the pipeline or after its lease was reclaimed.
 */
public interface PipelineStage {

  String name();

  /**
   * Runs before the model call, in registration order.
   *
   * @return a value to short-circuit the run with, skipping the model call
   */
  default Optional<ModelOutput> beforePipeline(PipelineContext context) throws Exception {
    return Optional.empty();
  }

  /**
   * Runs after every {@link #beforePipeline} hook, immediately before the model call.
   *
   * @return a value to short-circuit the run with, skipping the model call
   */
  default Optional<ModelOutput> beforeModelCall(PipelineContext context) throws Exception {
    return Optional.empty();
  }

  /** Runs only when the model call actually happened. */
  default void afterModelCall(PipelineContext context, ModelOutput output) throws Exception {}

  /** Runs once per successful run, whether or not the model call was short-circuited. */
  default void afterPipeline(PipelineContext context, ModelOutput output) throws Exception {}
}
