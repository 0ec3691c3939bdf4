package com.flamingo.ai.factextraction.domain.model;

/**
 * Audit record linking a chunk to the number of facts extracted from it.
 *
 * @param chunkText the chunk as it was sent to the LLM (before any auto-split)
 * @param factCount number of facts the chunk produced
 * @param contentIndex position of the source content item in the input
 * @param chunkIndex pipeline-global chunk index
 */
public record ChunkMetadata(String chunkText, int factCount, int contentIndex, int chunkIndex) {}
