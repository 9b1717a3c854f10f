package com.acme.assistant.worker.web;

import com.acme.assistant.worker.orchestrator.Orchestrator;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import java.util.LinkedHashMap;
import java.util.Map;

/** Liveness for the process supervisor: DOWN once the workers have stopped. */
@Controller
public class HealthController {
  static final String WORKERS_RUNNING = "running";
  static final String WORKERS_STOPPED = "stopped";
  static final String WORKERS_DISABLED = "disabled";

  private final Orchestrator orchestrator;

  public HealthController(@Nullable Orchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @Get("/health")
  public HttpResponse<Map<String, String>> health() {
    String workers =
        orchestrator == null
            ? WORKERS_DISABLED
            : orchestrator.isRunning() ? WORKERS_RUNNING : WORKERS_STOPPED;
    boolean up = !WORKERS_STOPPED.equals(workers);
    Map<String, String> body = new LinkedHashMap<>();
    body.put("status", up ? "UP" : "DOWN");
    body.put("workers", workers);
    return up
        ? HttpResponse.ok(body)
        : HttpResponse.<Map<String, String>>status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
  }
}
