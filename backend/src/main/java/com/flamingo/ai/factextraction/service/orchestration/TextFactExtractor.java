package com.flamingo.ai.factextraction.service.orchestration;

import com.flamingo.ai.factextraction.domain.model.ContentItem;
import com.flamingo.ai.factextraction.domain.model.ExtractionMode;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/** Extracts facts from a single content item, one {@link ChunkExtraction} per chunk. */
public interface TextFactExtractor {

  /**
   * Starts extraction for one content item.
   *
   * @return chunk results in chunk order; completes exceptionally on a fatal LLM or pipeline error
   */
  CompletableFuture<List<ChunkExtraction>> extract(
      ContentItem content, String agentName, ExtractionMode mode);
}
