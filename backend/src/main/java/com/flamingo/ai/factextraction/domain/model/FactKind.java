package com.flamingo.ai.factextraction.domain.model;

import java.util.Locale;

/**
 * Classification the LLM uses to decide whether a fact carries an occurrence range. Only used
 * while parsing; not stored on the fact.
 */
public enum FactKind {
  EVENT,
  CONVERSATION,
  OTHER;

  /** Resolves a raw {@code fact_kind} value, falling back to {@link #CONVERSATION}. */
  public static FactKind fromValue(Object raw) {
    if (raw instanceof String s) {
      switch (s.trim().toLowerCase(Locale.ROOT)) {
        case "event":
          return EVENT;
        case "other":
          return OTHER;
        default:
          return CONVERSATION;
      }
    }
    return CONVERSATION;
  }
}
