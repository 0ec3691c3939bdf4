package com.flamingo.ai.factextraction.exception;

/** Exception thrown when the extraction pipeline reaches a condition it cannot recover from. */
public class FactExtractionException extends RuntimeException {

  private final int chunkIndex;

  public FactExtractionException(int chunkIndex, String message) {
    super(message);
    this.chunkIndex = chunkIndex;
  }

  public FactExtractionException(int chunkIndex, String message, Throwable cause) {
    super(message, cause);
    this.chunkIndex = chunkIndex;
  }

  public int getChunkIndex() {
    return chunkIndex;
  }
}
