package com.acme.assistant.spi;

import com.acme.assistant.core.DeadLetterEntry;
import com.acme.assistant.core.DeadLetterFilter;
import com.acme.assistant.core.DeadLetterNotFoundException;
import com.acme.assistant.core.DeadLetterStats;
import java.util.List;
import java.util.Optional;

/** Durable store of events that permanently failed processing. */
public interface DeadLetterStore {

  /** Append an entry and return its assigned dlqId. */
  String append(DeadLetterEntry entry);

  /** Entries matching {@code filter} in failure order, at most {@code limit}. */
  List<DeadLetterEntry> list(DeadLetterFilter filter, int limit);

  Optional<DeadLetterEntry> get(String dlqId);

  /**
   * Re-inject the entry's payload into the input stream as a brand-new event and remove the entry.
   *
   * @return id of the new event
   * @throws DeadLetterNotFoundException when no entry has that id
   */
  String requeue(String dlqId);

  /**
   * @throws DeadLetterNotFoundException when no entry has that id
   */
  void delete(String dlqId);

  /** Delete every entry matching {@code filter}; returns how many were removed. */
  long purge(DeadLetterFilter filter);

  DeadLetterStats stats();

  /** Number of entries held, 0 when the store does not exist yet. */
  long depth();
}
