package com.acme.assistant.config;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Names and timings of the input stream subscription, the output stream and the dead-letter stream.
 * Pure POJO - no framework dependencies.
 */
public class StreamConfig {
  private static final Logger LOG = LoggerFactory.getLogger(StreamConfig.class);

  private String inputStream = "to_secretary";
  private String group = "assistant";
  private String consumerName = defaultConsumerName();
  private Duration blockTimeout = Duration.ofSeconds(5);
  private Duration idleTimeout = Duration.ofSeconds(60);
  private Duration reclaimInterval = Duration.ofSeconds(30);
  private int reclaimBatchSize = 10;
  private String outputStream = "to_telegram";
  private String dlqSuffix = ":dlq";
  private String payloadField = "payload";

  public String getInputStream() {
    return inputStream;
  }

  public void setInputStream(String inputStream) {
    this.inputStream = inputStream;
  }

  public String getGroup() {
    return group;
  }

  public void setGroup(String group) {
    this.group = group;
  }

  public String getConsumerName() {
    return consumerName;
  }

  public void setConsumerName(String consumerName) {
    this.consumerName = consumerName;
  }

  public Duration getBlockTimeout() {
    return blockTimeout;
  }

  public void setBlockTimeout(Duration blockTimeout) {
    this.blockTimeout = blockTimeout;
  }

  public Duration getIdleTimeout() {
    return idleTimeout;
  }

  public void setIdleTimeout(Duration idleTimeout) {
    this.idleTimeout = idleTimeout;
  }

  public Duration getReclaimInterval() {
    return reclaimInterval;
  }

  public void setReclaimInterval(Duration reclaimInterval) {
    this.reclaimInterval = reclaimInterval;
  }

  public int getReclaimBatchSize() {
    return reclaimBatchSize;
  }

  public void setReclaimBatchSize(int reclaimBatchSize) {
    this.reclaimBatchSize = reclaimBatchSize;
  }

  public String getOutputStream() {
    return outputStream;
  }

  public void setOutputStream(String outputStream) {
    this.outputStream = outputStream;
  }

  public String getDlqSuffix() {
    return dlqSuffix;
  }

  public void setDlqSuffix(String dlqSuffix) {
    this.dlqSuffix = dlqSuffix;
  }

  public String getPayloadField() {
    return payloadField;
  }

  public void setPayloadField(String payloadField) {
    this.payloadField = payloadField;
  }

  /** Dead-letter stream name. Example: to_secretary -> to_secretary:dlq */
  public String getDlqStream() {
    return inputStream + dlqSuffix;
  }

  /** Consumer name of the n-th worker in this process. Example: assistant-host-2 */
  public String consumerNameFor(int workerIndex) {
    return consumerName + "-" + workerIndex;
  }

  /**
   * Reject settings the consumer cannot run with. Redelivery of a failed event waits for its lease
   * to go stale, so an idle timeout shorter than the largest backoff only earns a warning.
   */
  public void validate(RetryConfig retry) {
    if (inputStream == null || inputStream.isBlank()) {
      throw new IllegalArgumentException("assistant.stream.input-stream must not be blank");
    }
    if (group == null || group.isBlank()) {
      throw new IllegalArgumentException("assistant.stream.group must not be blank");
    }
    if (reclaimBatchSize < 1) {
      throw new IllegalArgumentException(
          "assistant.stream.reclaim-batch-size must be >= 1, was " + reclaimBatchSize);
    }
    retry.validate();
    Duration largest = retry.largestBackoff();
    if (idleTimeout.compareTo(largest) < 0) {
      LOG.warn(
          "Idle timeout {} is shorter than the largest backoff {}; redelivery will not honour it",
          idleTimeout,
          largest);
    }
  }

  static String defaultConsumerName() {
    try {
      return "assistant-" + InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      LOG.debug("Could not resolve local host name, using generic consumer name", e);
      return "assistant-worker";
    }
  }
}
