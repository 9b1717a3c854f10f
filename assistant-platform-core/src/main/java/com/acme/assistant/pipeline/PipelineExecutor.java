package com.acme.assistant.pipeline;

import com.acme.assistant.core.StageException;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs stages over a {@link PipelineContext}.
 *
 * <p>Order: every {@code beforePipeline} hook, every {@code beforeModelCall} hook, the model call,
 * every {@code afterModelCall} hook, then every {@code afterPipeline} hook, each phase in
 * registration order. A before-hook returning a value short-circuits: remaining before-hooks, the
 * model call and the {@code afterModelCall} hooks are skipped, and the {@code afterPipeline} hooks
 * receive that value instead of a model output. Any error aborts the run and yields {@link
 * Outcome.Failure}; nothing already done by earlier stages is rolled back.
 *
 * <p>The executor knows nothing about queues and never throws for a stage failure.
 */
public class PipelineExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(PipelineExecutor.class);

  public Outcome run(Pipeline pipeline, PipelineContext context) {
    return run(pipeline.stages(), pipeline.modelCall(), context);
  }

  public Outcome run(
      List<PipelineStage> stages, ModelCallStage modelCall, PipelineContext context) {
    try {
      ModelOutput output = runBeforeHooks(stages, context);
      if (output == null) {
        output = invoke(modelCall.name(), PipelineHook.MODEL_CALL, () -> modelCall.call(context));
        if (output == null) {
          output = ModelOutput.empty(modelCall.name());
        }
        context.setOutput(output);
        for (PipelineStage stage : stages) {
          ModelOutput produced = output;
          invoke(
              stage.name(),
              PipelineHook.AFTER_MODEL_CALL,
              () -> {
                stage.afterModelCall(context, produced);
                return null;
              });
        }
      }
      for (PipelineStage stage : stages) {
        ModelOutput produced = output;
        invoke(
            stage.name(),
            PipelineHook.AFTER_PIPELINE,
            () -> {
              stage.afterPipeline(context, produced);
              return null;
            });
      }
      return Outcome.success(context);
    } catch (StageException e) {
      LOG.debug(
          "Pipeline failed for event {} in stage {} ({})",
          context.getEventId(),
          e.getStageName(),
          e.getHook(),
          e);
      return Outcome.failure(e);
    }
  }

  /** Returns the short-circuit value, or {@code null} when the model call should run. */
  private ModelOutput runBeforeHooks(List<PipelineStage> stages, PipelineContext context) {
    for (PipelineStage stage : stages) {
      Optional<ModelOutput> result =
          invoke(stage.name(), PipelineHook.BEFORE_PIPELINE, () -> stage.beforePipeline(context));
      if (result != null && result.isPresent()) {
        return shortCircuit(context, stage, result.get());
      }
    }
    for (PipelineStage stage : stages) {
      Optional<ModelOutput> result =
          invoke(
              stage.name(), PipelineHook.BEFORE_MODEL_CALL, () -> stage.beforeModelCall(context));
      if (result != null && result.isPresent()) {
        return shortCircuit(context, stage, result.get());
      }
    }
    return null;
  }

  private ModelOutput shortCircuit(PipelineContext context, PipelineStage stage, ModelOutput value) {
    LOG.debug("Stage {} short-circuited event {}", stage.name(), context.getEventId());
    context.markShortCircuited();
    context.setOutput(value);
    return value;
  }

  private <T> T invoke(String stageName, PipelineHook hook, HookCall<T> call) {
    long start = System.nanoTime();
    try {
      T result = call.call();
      if (LOG.isTraceEnabled()) {
        LOG.trace("{} {} took {}us", stageName, hook, (System.nanoTime() - start) / 1_000);
      }
      return result;
    } catch (StageException e) {
      throw e;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StageException(stageName, hook, "Interrupted in " + stageName, e);
    } catch (Exception e) {
      throw new StageException(
          stageName, hook, "Stage " + stageName + " failed at " + hook + ": " + e.getMessage(), e);
    }
  }

  @FunctionalInterface
  private interface HookCall<T> {
    T call() throws Exception;
  }
}
