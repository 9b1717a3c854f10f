package com.acme.assistant.config;

import java.time.Duration;

/** Worker loop settings. Pure POJO - no framework dependencies. */
public class WorkerConfig {

  private boolean enabled = true;
  private int concurrency = 1;
  private Duration shutdownTimeout = Duration.ofSeconds(30);
  private Duration transportBackoffInitial = Duration.ofMillis(100);
  private Duration transportBackoffMax = Duration.ofSeconds(5);
  private Duration dlqMetricsInterval = Duration.ofSeconds(60);
  private int publishAttempts = 3;

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public int getConcurrency() {
    return concurrency;
  }

  public void setConcurrency(int concurrency) {
    this.concurrency = concurrency;
  }

  public Duration getShutdownTimeout() {
    return shutdownTimeout;
  }

  public void setShutdownTimeout(Duration shutdownTimeout) {
    this.shutdownTimeout = shutdownTimeout;
  }

  public Duration getTransportBackoffInitial() {
    return transportBackoffInitial;
  }

  public void setTransportBackoffInitial(Duration transportBackoffInitial) {
    this.transportBackoffInitial = transportBackoffInitial;
  }

  public Duration getTransportBackoffMax() {
    return transportBackoffMax;
  }

  public void setTransportBackoffMax(Duration transportBackoffMax) {
    this.transportBackoffMax = transportBackoffMax;
  }

  public Duration getDlqMetricsInterval() {
    return dlqMetricsInterval;
  }

  public void setDlqMetricsInterval(Duration dlqMetricsInterval) {
    this.dlqMetricsInterval = dlqMetricsInterval;
  }

  public int getPublishAttempts() {
    return publishAttempts;
  }

  public void setPublishAttempts(int publishAttempts) {
    this.publishAttempts = publishAttempts;
  }

  /** Transport backoff for the given consecutive failure (1-based): initial doubled, capped. */
  public Duration transportBackoff(int consecutiveFailures) {
    long initial = transportBackoffInitial.toMillis();
    long max = transportBackoffMax.toMillis();
    int shift = Math.min(Math.max(consecutiveFailures - 1, 0), 30);
    long millis = Math.min(initial << shift, max);
    return Duration.ofMillis(millis < 0 ? max : millis);
  }
}
