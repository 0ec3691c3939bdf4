package com.flamingo.ai.factextraction.domain.model;

import java.util.Locale;
import java.util.Optional;

/** Perspective of an extracted fact. */
public enum FactType {
  /** About the user or other people and the world around them. */
  WORLD("world"),
  /** An interaction the agent itself took part in. */
  EXPERIENCE("experience"),
  /** A formed belief or stance. */
  OPINION("opinion");

  private final String value;

  FactType(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /** Resolves the wire value produced by the LLM; empty when it is not a known fact type. */
  public static Optional<FactType> fromValue(Object raw) {
    if (!(raw instanceof String s)) {
      return Optional.empty();
    }
    String normalized = s.trim().toLowerCase(Locale.ROOT);
    for (FactType type : values()) {
      if (type.value.equals(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
