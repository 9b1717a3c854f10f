package com.acme.assistant.pipeline;

/** The terminal action of a pipeline run. */
public interface ModelCallStage {

  String name();

  ModelOutput call(PipelineContext context) throws Exception;
}
