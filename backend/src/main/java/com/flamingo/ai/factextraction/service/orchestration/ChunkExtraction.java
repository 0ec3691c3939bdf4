package com.flamingo.ai.factextraction.service.orchestration;

import com.flamingo.ai.factextraction.service.extraction.ChunkFact;
import java.util.List;

/**
 * Facts extracted from one chunk of a content item.
 *
 * @param chunkText the chunk as produced by the chunker
 * @param facts facts in response order, relation targets local to this list
 */
public record ChunkExtraction(String chunkText, List<ChunkFact> facts) {

  public ChunkExtraction {
    facts = List.copyOf(facts);
  }
}
