package com.acme.assistant.core;

import java.time.Instant;
import java.util.Map;

/** Operator summary of the dead-letter store. Timestamps are {@code null} when it is empty. */
public record DeadLetterStats(
    String queueName,
    long totalMessages,
    Map<String, Long> byErrorKind,
    Instant oldestFailedAt,
    Instant newestFailedAt) {}
