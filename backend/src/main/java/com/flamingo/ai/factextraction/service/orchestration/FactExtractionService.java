package com.flamingo.ai.factextraction.service.orchestration;

import com.flamingo.ai.factextraction.domain.model.ContentItem;
import com.flamingo.ai.factextraction.domain.model.ExtractionMode;
import com.flamingo.ai.factextraction.domain.model.FactExtractionResult;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point of the fact extraction pipeline: extracts facts from a batch of content items and
 * merges them into one globally ordered result.
 */
public interface FactExtractionService {

  /**
   * Extracts facts and waits for the result.
   *
   * @param contents items to extract from, merged in this order
   * @param agentName name of the agent, used when extracting opinions
   * @param mode which fact types to extract
   * @throws com.flamingo.ai.factextraction.exception.LlmServiceException if the LLM provider fails
   * @throws com.flamingo.ai.factextraction.exception.FactExtractionException if a chunk cannot be
   *     extracted at all
   */
  FactExtractionResult extractFacts(
      List<ContentItem> contents, String agentName, ExtractionMode mode);

  /** Asynchronous variant of {@link #extractFacts}; fatal errors complete the future. */
  CompletableFuture<FactExtractionResult> extractFactsAsync(
      List<ContentItem> contents, String agentName, ExtractionMode mode);
}
