package com.acme.assistant.worker.ports;

import io.micronaut.context.annotation.Secondary;
import jakarta.inject.Singleton;
import java.util.List;

/** Placeholder until a real model is wired in. Summaries keep the previous one unchanged. */
@Singleton
@Secondary
public class NoOpLanguageModel implements LanguageModel {
  public static final String REPLY = "[No language model configured]";

  @Override
  public String complete(ModelRequest request) {
    return REPLY;
  }

  @Override
  public String summarize(String userId, String previousSummary, List<ModelMessage> messages) {
    return previousSummary == null ? "" : previousSummary;
  }
}
