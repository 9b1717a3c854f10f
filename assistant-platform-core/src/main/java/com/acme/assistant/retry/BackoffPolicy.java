package com.acme.assistant.retry;

import java.time.Duration;
import java.util.List;

/**
 * Maps a retry count to a delay: {@code schedule[count - 1]}, with the last value repeating once
 * the count runs past the end of the schedule.
 */
public class BackoffPolicy {
  private final List<Duration> schedule;

  public BackoffPolicy(List<Duration> schedule) {
    if (schedule == null || schedule.isEmpty()) {
      throw new IllegalArgumentException("Backoff schedule must not be empty");
    }
    this.schedule = List.copyOf(schedule);
  }

  /**
   * @param retryCount 1-based count of failures so far
   */
  public Duration delayFor(long retryCount) {
    if (retryCount < 1) {
      throw new IllegalArgumentException("Retry count must be >= 1, was " + retryCount);
    }
    int index = (int) Math.min(retryCount - 1, schedule.size() - 1);
    return schedule.get(index);
  }

  public List<Duration> schedule() {
    return schedule;
  }
}
