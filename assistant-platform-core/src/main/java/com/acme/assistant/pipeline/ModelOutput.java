package com.acme.assistant.pipeline;

/**
 * Result handed to the after-hooks: the terminal model call's reply, or the value a stage
 * short-circuited with.
 *
 * @param producedBy name of the stage that produced it
 */
public record ModelOutput(String content, String producedBy) {

  public ModelOutput {
    content = content == null ? "" : content;
  }

  public static ModelOutput empty(String producedBy) {
    return new ModelOutput("", producedBy);
  }

  public boolean isBlank() {
    return content.isBlank();
  }
}
