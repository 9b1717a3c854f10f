package com.acme.assistant.pipeline;

import java.util.List;
import java.util.Objects;

/** Stages in registration order plus the terminal model call. */
public record Pipeline(List<PipelineStage> stages, ModelCallStage modelCall) {

  public Pipeline {
    stages = List.copyOf(stages);
    Objects.requireNonNull(modelCall, "modelCall");
  }

  public List<String> stageNames() {
    return stages.stream().map(PipelineStage::name).toList();
  }
}
