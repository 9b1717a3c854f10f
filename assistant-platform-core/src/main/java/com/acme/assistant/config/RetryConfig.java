package com.acme.assistant.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** Retry budget and backoff schedule for failed events. Pure POJO - no framework dependencies. */
public class RetryConfig {

  private int maxRetries = 3;
  private List<Duration> backoffSchedule =
      new ArrayList<>(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4)));
  private Duration ledgerTtl = Duration.ofHours(1);
  private String keyPrefix = "msg_retry:";
  private boolean sleepOnRetry = false;

  public int getMaxRetries() {
    return maxRetries;
  }

  public void setMaxRetries(int maxRetries) {
    this.maxRetries = maxRetries;
  }

  public List<Duration> getBackoffSchedule() {
    return backoffSchedule;
  }

  public void setBackoffSchedule(List<Duration> backoffSchedule) {
    this.backoffSchedule = backoffSchedule;
  }

  public Duration getLedgerTtl() {
    return ledgerTtl;
  }

  public void setLedgerTtl(Duration ledgerTtl) {
    this.ledgerTtl = ledgerTtl;
  }

  public String getKeyPrefix() {
    return keyPrefix;
  }

  public void setKeyPrefix(String keyPrefix) {
    this.keyPrefix = keyPrefix;
  }

  public boolean isSleepOnRetry() {
    return sleepOnRetry;
  }

  public void setSleepOnRetry(boolean sleepOnRetry) {
    this.sleepOnRetry = sleepOnRetry;
  }

  public Duration largestBackoff() {
    return backoffSchedule.stream().max(Duration::compareTo).orElse(Duration.ZERO);
  }

  public void validate() {
    if (maxRetries < 1) {
      throw new IllegalArgumentException("assistant.retry.max-retries must be >= 1, was " + maxRetries);
    }
    if (backoffSchedule == null || backoffSchedule.isEmpty()) {
      throw new IllegalArgumentException("assistant.retry.backoff-schedule must not be empty");
    }
    if (backoffSchedule.stream().anyMatch(d -> d == null || d.isNegative())) {
      throw new IllegalArgumentException(
          "assistant.retry.backoff-schedule must only contain non-negative durations");
    }
  }
}
