package com.flamingo.ai.factextraction.domain.model;

import java.util.Locale;
import java.util.Optional;

/** Direction and nature of a causal link from one fact to an earlier one. */
public enum CausalRelationType {
  CAUSES("causes"),
  CAUSED_BY("caused_by"),
  ENABLES("enables"),
  PREVENTS("prevents");

  private final String value;

  CausalRelationType(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  public static Optional<CausalRelationType> fromValue(Object raw) {
    if (!(raw instanceof String s)) {
      return Optional.empty();
    }
    String normalized = s.trim().toLowerCase(Locale.ROOT);
    for (CausalRelationType type : values()) {
      if (type.value.equals(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
