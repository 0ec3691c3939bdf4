package com.flamingo.ai.factextraction.domain.model;

/** Which fact types an extraction run asks the LLM for. */
public enum ExtractionMode {
  /** World and experience facts; opinions are extracted in a separate run. */
  FACTS,
  /** Only opinions held by the agent. */
  OPINIONS
}
