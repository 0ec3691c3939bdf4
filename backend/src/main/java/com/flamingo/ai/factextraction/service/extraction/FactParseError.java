package com.flamingo.ai.factextraction.service.extraction;

/** Reasons a single entry of the LLM's facts array is rejected. */
public enum FactParseError {
  /** The entry is not a JSON object. */
  NOT_AN_OBJECT,
  /** Neither {@code what} nor the legacy {@code factual_core} field has a value. */
  MISSING_WHAT
}
