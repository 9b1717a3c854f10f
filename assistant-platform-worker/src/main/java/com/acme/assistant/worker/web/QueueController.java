package com.acme.assistant.worker.web;

import com.acme.assistant.config.StreamConfig;
import com.acme.assistant.retry.RetryPolicy;
import com.acme.assistant.spi.DeadLetterStore;
import com.acme.assistant.spi.QueueInspector;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import java.util.LinkedHashMap;
import java.util.Map;

@Controller("/queue")
public class QueueController {
  private final QueueInspector inspector;
  private final DeadLetterStore deadLetterStore;
  private final RetryPolicy retryPolicy;
  private final StreamConfig streamConfig;

  public QueueController(
      QueueInspector inspector,
      DeadLetterStore deadLetterStore,
      RetryPolicy retryPolicy,
      StreamConfig streamConfig) {
    this.inspector = inspector;
    this.deadLetterStore = deadLetterStore;
    this.retryPolicy = retryPolicy;
    this.streamConfig = streamConfig;
  }

  @Get("/status")
  public Map<String, Object> status() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("stream", streamConfig.getInputStream());
    body.put("group", streamConfig.getGroup());
    body.put("streamLength", inspector.streamLength());
    body.put("pendingCount", inspector.pendingCount());
    body.put("dlqStream", streamConfig.getDlqStream());
    body.put("dlqDepth", deadLetterStore.depth());
    return body;
  }

  @Get("/retries/{eventId}")
  public Map<String, Object> retries(@PathVariable String eventId) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("eventId", eventId);
    body.put("retryCount", retryPolicy.currentCount(eventId));
    body.put("maxRetries", retryPolicy.getMaxRetries());
    return body;
  }
}
