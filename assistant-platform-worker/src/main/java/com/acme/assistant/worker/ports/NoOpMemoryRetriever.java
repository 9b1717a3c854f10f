package com.acme.assistant.worker.ports;

import io.micronaut.context.annotation.Secondary;
import jakarta.inject.Singleton;
import java.util.List;

@Singleton
@Secondary
public class NoOpMemoryRetriever implements MemoryRetriever {

  @Override
  public List<Memory> retrieve(String userId, String query, int limit, double threshold) {
    return List.of();
  }
}
