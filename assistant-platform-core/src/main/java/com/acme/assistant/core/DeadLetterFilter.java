package com.acme.assistant.core;

/**
 * Selects dead-letter entries by error kind and/or one source-metadata key/value. A {@code null}
 * component matches everything.
 */
public record DeadLetterFilter(String errorKind, String metadataKey, String metadataValue) {

  private static final DeadLetterFilter ALL = new DeadLetterFilter(null, null, null);

  public static DeadLetterFilter all() {
    return ALL;
  }

  public static DeadLetterFilter byErrorKind(String errorKind) {
    return new DeadLetterFilter(blankToNull(errorKind), null, null);
  }

  public static DeadLetterFilter byMetadata(String key, String value) {
    return new DeadLetterFilter(null, key, blankToNull(value));
  }

  public DeadLetterFilter andMetadata(String key, String value) {
    return new DeadLetterFilter(errorKind, key, blankToNull(value));
  }

  public boolean matchesAll() {
    return errorKind == null && metadataValue == null;
  }

  public boolean matches(DeadLetterEntry entry) {
    if (errorKind != null && !errorKind.equals(entry.errorKind())) {
      return false;
    }
    if (metadataKey != null && metadataValue != null) {
      return metadataValue.equals(entry.sourceMetadata().get(metadataKey));
    }
    return true;
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
