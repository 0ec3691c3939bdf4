package com.flamingo.ai.factextraction.llm;

/** How an {@link LlmClient} treats the JSON returned by the model. */
public enum ValidationMode {
  /** Convert the response into the request's response type; fail if it does not fit. */
  STRICT,
  /** Return the decoded JSON untouched so the caller can validate it entry by entry. */
  LENIENT
}
