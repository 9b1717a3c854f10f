package com.acme.assistant.worker.orchestrator;

import java.time.Duration;

/** Blocking pause used for backoff. */
@FunctionalInterface
public interface Sleeper {
  Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
