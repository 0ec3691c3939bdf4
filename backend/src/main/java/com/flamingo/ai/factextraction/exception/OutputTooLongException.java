package com.flamingo.ai.factextraction.exception;

/** Exception thrown when the LLM stops generating because it hit its output token budget. */
public class OutputTooLongException extends RuntimeException {

  private final int maxOutputTokens;

  public OutputTooLongException(String scope, int maxOutputTokens) {
    super(
        String.format(
            "LLM output for scope '%s' was truncated at the %d token budget",
            scope, maxOutputTokens));
    this.maxOutputTokens = maxOutputTokens;
  }

  public int getMaxOutputTokens() {
    return maxOutputTokens;
  }
}
