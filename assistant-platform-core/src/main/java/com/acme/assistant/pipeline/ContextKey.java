package com.acme.assistant.pipeline;

import java.util.Objects;

/** Typed key of a derived value stored in a {@link PipelineContext}. */
public final class ContextKey<T> {
  private final String name;

  private ContextKey(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  public static <T> ContextKey<T> of(String name) {
    return new ContextKey<>(name);
  }

  public String name() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof ContextKey<?> other && name.equals(other.name));
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
