package com.acme.assistant.worker.ports;

import java.util.List;

/** Language model used by the terminal model call and by history summarization. */
public interface LanguageModel {

  String SUMMARY_INSTRUCTION =
      "Summarize the conversation below, extending the previous summary if there is one. Keep"
          + " facts about the user, open tasks and decisions.";

  String complete(ModelRequest request);

  /** Fold {@code messages} into {@code previousSummary}. */
  default String summarize(String userId, String previousSummary, List<ModelMessage> messages) {
    return complete(new ModelRequest(userId, SUMMARY_INSTRUCTION, previousSummary, List.of(), messages));
  }
}
