package com.acme.assistant.worker.ports;

import java.util.List;

/**
 * Input of a language model call.
 *
 * @param instruction task-specific instruction, {@code null} for a normal reply
 * @param summary running summary of older conversation, may be {@code null}
 * @param memories retrieved long-term memories, most relevant first
 * @param messages recent conversation, oldest first, ending with the current input
 */
public record ModelRequest(
    String userId,
    String instruction,
    String summary,
    List<String> memories,
    List<ModelMessage> messages) {

  public ModelRequest {
    memories = memories == null ? List.of() : List.copyOf(memories);
    messages = messages == null ? List.of() : List.copyOf(messages);
  }
}
