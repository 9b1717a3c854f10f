package com.acme.assistant.pipeline;

import com.acme.assistant.core.StreamEvent;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable state of one pipeline run: the event being processed plus everything the stages derive
 * from it. Created fresh per event and never shared between events, so it needs no
 * synchronization.
 */
public class PipelineContext {
  private final StreamEvent event;
  private final Clock clock;
  private final Map<ContextKey<?>, Object> attributes = new HashMap<>();
  private final Map<String, String> sourceMetadata = new LinkedHashMap<>();
  private final List<SideEffect> sideEffects = new ArrayList<>();
  private ModelOutput output;
  private boolean shortCircuited;
  private OutboundMessage outbound;

  public PipelineContext(StreamEvent event) {
    this(event, Clock.systemUTC());
  }

  public PipelineContext(StreamEvent event, Clock clock) {
    this.event = Objects.requireNonNull(event, "event");
    this.clock = clock;
  }

  public StreamEvent getEvent() {
    return event;
  }

  public String getEventId() {
    return event.id();
  }

  public <T> void put(ContextKey<T> key, T value) {
    attributes.put(key, value);
  }

  @SuppressWarnings("unchecked")
  public <T> Optional<T> get(ContextKey<T> key) {
    return Optional.ofNullable((T) attributes.get(key));
  }

  /**
   * @throws IllegalStateException when no earlier stage stored the value
   */
  public <T> T require(ContextKey<T> key) {
    return get(key)
        .orElseThrow(() -> new IllegalStateException("Context value missing: " + key.name()));
  }

  public boolean has(ContextKey<?> key) {
    return attributes.containsKey(key);
  }

  /** Metadata copied onto a dead-letter entry should this event fail permanently. */
  public void putSourceMetadata(String key, String value) {
    if (value != null) {
      sourceMetadata.put(key, value);
    }
  }

  public Map<String, String> getSourceMetadata() {
    return Collections.unmodifiableMap(sourceMetadata);
  }

  public void recordSideEffect(String stage, String description) {
    sideEffects.add(new SideEffect(stage, description, clock.instant()));
  }

  public List<SideEffect> getSideEffects() {
    return Collections.unmodifiableList(sideEffects);
  }

  public Optional<ModelOutput> getOutput() {
    return Optional.ofNullable(output);
  }

  void setOutput(ModelOutput output) {
    this.output = output;
  }

  public boolean isShortCircuited() {
    return shortCircuited;
  }

  void markShortCircuited() {
    this.shortCircuited = true;
  }

  public Optional<OutboundMessage> getOutbound() {
    return Optional.ofNullable(outbound);
  }

  public void setOutbound(OutboundMessage outbound) {
    this.outbound = outbound;
  }
}
