package com.acme.assistant.worker.web;

import com.acme.assistant.core.DeadLetterFilter;
import com.acme.assistant.core.DeadLetterNotFoundException;
import com.acme.assistant.core.DeadLetterStats;
import com.acme.assistant.spi.DeadLetterStore;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Delete;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.QueryValue;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operator endpoints over the dead-letter store: inspect, requeue, delete and purge. Requeue and
 * delete are the only ways an entry leaves the store.
 */
@Controller("/dlq")
public class DeadLetterController {
  private static final Logger LOG = LoggerFactory.getLogger(DeadLetterController.class);
  static final int DEFAULT_LIMIT = 50;
  static final int MAX_LIMIT = 100;
  static final String USER_ID_KEY = "user_id";

  private final DeadLetterStore store;

  public DeadLetterController(DeadLetterStore store) {
    this.store = store;
  }

  @Get("/messages")
  public List<DeadLetterView> list(
      @QueryValue @Nullable String errorKind,
      @QueryValue @Nullable String userId,
      @QueryValue @Nullable Integer limit) {
    int effectiveLimit = limit == null ? DEFAULT_LIMIT : limit;
    if (effectiveLimit < 1 || effectiveLimit > MAX_LIMIT) {
      throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
    }
    DeadLetterFilter filter =
        DeadLetterFilter.byErrorKind(errorKind).andMetadata(USER_ID_KEY, userId);
    return store.list(filter, effectiveLimit).stream().map(DeadLetterView::of).toList();
  }

  @Get("/messages/{dlqId}")
  public DeadLetterView get(@PathVariable String dlqId) {
    return store
        .get(dlqId)
        .map(DeadLetterView::of)
        .orElseThrow(() -> new DeadLetterNotFoundException(dlqId));
  }

  @Get("/stats")
  public DeadLetterStats stats() {
    return store.stats();
  }

  @Post("/messages/{dlqId}/requeue")
  public HttpResponse<Map<String, Object>> requeue(@PathVariable String dlqId) {
    String newEventId = store.requeue(dlqId);
    LOG.info("Operator requeued DLQ entry {} as event {}", dlqId, newEventId);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "requeued");
    body.put("dlqId", dlqId);
    body.put("newEventId", newEventId);
    return HttpResponse.accepted().body(body);
  }

  @Delete("/messages/{dlqId}")
  public Map<String, Object> delete(@PathVariable String dlqId) {
    store.delete(dlqId);
    LOG.info("Operator deleted DLQ entry {}", dlqId);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "deleted");
    body.put("dlqId", dlqId);
    return body;
  }

  @Delete("/messages")
  public Map<String, Object> purge(@QueryValue @Nullable String errorKind) {
    DeadLetterFilter filter = DeadLetterFilter.byErrorKind(errorKind);
    long deleted = store.purge(filter);
    LOG.warn("Operator purged {} DLQ entries (errorKind={})", deleted, filter.errorKind());
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "purged");
    body.put("deletedCount", deleted);
    body.put("filter", filter.errorKind() == null ? "all" : filter.errorKind());
    return body;
  }
}
