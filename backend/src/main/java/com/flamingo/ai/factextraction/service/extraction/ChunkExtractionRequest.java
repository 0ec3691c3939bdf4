package com.flamingo.ai.factextraction.service.extraction;

import com.flamingo.ai.factextraction.domain.model.ExtractionMode;
import java.time.OffsetDateTime;

/**
 * Input for extracting facts from a single chunk.
 *
 * @param chunk text sent to the LLM
 * @param chunkIndex position of the chunk within its content item
 * @param totalChunks number of chunks in the content item
 * @param eventDate reference date for relative time expressions
 * @param context description of the content item's source
 * @param agentName name of the agent, used when extracting opinions
 * @param mode which fact types to extract
 */
public record ChunkExtractionRequest(
    String chunk,
    int chunkIndex,
    int totalChunks,
    OffsetDateTime eventDate,
    String context,
    String agentName,
    ExtractionMode mode) {

  /** Sub-chunks produced by auto-split keep the position of the chunk they came from. */
  public ChunkExtractionRequest withChunk(String subChunk) {
    return new ChunkExtractionRequest(
        subChunk, chunkIndex, totalChunks, eventDate, context, agentName, mode);
  }
}
