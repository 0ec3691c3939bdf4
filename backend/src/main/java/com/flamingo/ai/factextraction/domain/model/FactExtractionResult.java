package com.flamingo.ai.factextraction.domain.model;

import java.util.List;

/**
 * Output of an extraction run: facts in global order and one metadata record per chunk.
 *
 * <p>Fact {@code i} in {@link #facts()} has global index {@code i}; causal relation targets refer
 * to these indices.
 */
public record FactExtractionResult(List<ExtractedFact> facts, List<ChunkMetadata> chunks) {

  public FactExtractionResult {
    facts = List.copyOf(facts);
    chunks = List.copyOf(chunks);
  }

  public static FactExtractionResult empty() {
    return new FactExtractionResult(List.of(), List.of());
  }
}
