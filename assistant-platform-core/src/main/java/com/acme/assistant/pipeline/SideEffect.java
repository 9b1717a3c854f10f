package com.acme.assistant.pipeline;

import java.time.Instant;

/** Diagnostic record of something a stage did outside the context. */
public record SideEffect(String stage, String description, Instant at) {}
