package com.acme.assistant.worker.web.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.slf4j.MDC;
import org.slf4j.Marker;

/** Puts the worker thread's name and id into the MDC for the log pattern. */
public class ThreadIdTurboFilter extends TurboFilter {
  static final String THREAD_ID_KEY = "threadId";
  static final String THREAD_NAME_KEY = "threadName";

  @Override
  public FilterReply decide(
      Marker marker, Logger logger, Level level, String format, Object[] params, Throwable t) {
    Thread current = Thread.currentThread();
    MDC.put(THREAD_ID_KEY, String.valueOf(current.getId()));
    MDC.put(THREAD_NAME_KEY, current.getName());
    return FilterReply.NEUTRAL;
  }
}
