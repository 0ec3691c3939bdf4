package com.flamingo.ai.factextraction.service.extraction;

/**
 * Outcome of normalizing one raw fact entry: either a fact or the reason it was rejected.
 *
 * @param fact the parsed fact, {@code null} when rejected
 * @param error why the entry was rejected, {@code null} when parsed
 * @param repaired whether a field had to be guessed (for example a defaulted fact type)
 */
public record EntryParseResult(ChunkFact fact, FactParseError error, boolean repaired) {

  public static EntryParseResult parsed(ChunkFact fact, boolean repaired) {
    return new EntryParseResult(fact, null, repaired);
  }

  public static EntryParseResult rejected(FactParseError error) {
    return new EntryParseResult(null, error, false);
  }

  public boolean isParsed() {
    return fact != null;
  }
}
