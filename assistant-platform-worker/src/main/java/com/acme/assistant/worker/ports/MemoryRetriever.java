package com.acme.assistant.worker.ports;

import java.util.List;

public interface MemoryRetriever {

  /** Up to {@code limit} memories of the user scoring at least {@code threshold}, best first. */
  List<Memory> retrieve(String userId, String query, int limit, double threshold);
}
