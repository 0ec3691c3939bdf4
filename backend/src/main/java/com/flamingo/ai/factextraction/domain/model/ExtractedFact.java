package com.flamingo.ai.factextraction.domain.model;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * A fact in the merged output of an extraction run.
 *
 * @param factText combined "what | When: ... | Involving: ... | why" text
 * @param factType perspective of the fact
 * @param occurredStart when the event started; {@code null} for non-event facts
 * @param occurredEnd when the event ended; equals {@code occurredStart} for point events
 * @param mentionedAt when the fact was mentioned (the content's event date plus ordering offset)
 * @param where location of the fact, if the LLM provided one
 * @param entities named entities mentioned by the fact
 * @param causalRelations links to facts with a smaller global index
 * @param contentIndex position of the source content item in the input
 * @param chunkIndex pipeline-global index of the chunk the fact came from
 * @param context context string of the source content item
 * @param metadata metadata of the source content item
 */
public record ExtractedFact(
    String factText,
    FactType factType,
    OffsetDateTime occurredStart,
    OffsetDateTime occurredEnd,
    OffsetDateTime mentionedAt,
    String where,
    List<String> entities,
    List<CausalRelation> causalRelations,
    int contentIndex,
    int chunkIndex,
    String context,
    Map<String, String> metadata) {

  public ExtractedFact {
    entities = entities != null ? List.copyOf(entities) : List.of();
    causalRelations = causalRelations != null ? List.copyOf(causalRelations) : List.of();
    metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
  }

  public ExtractedFact withCausalRelations(List<CausalRelation> relations) {
    return new ExtractedFact(
        factText,
        factType,
        occurredStart,
        occurredEnd,
        mentionedAt,
        where,
        entities,
        relations,
        contentIndex,
        chunkIndex,
        context,
        metadata);
  }

  /** Returns a copy with {@code offset} added to every timestamp that is set. */
  public ExtractedFact shiftedBy(Duration offset) {
    return new ExtractedFact(
        factText,
        factType,
        occurredStart != null ? occurredStart.plus(offset) : null,
        occurredEnd != null ? occurredEnd.plus(offset) : null,
        mentionedAt != null ? mentionedAt.plus(offset) : null,
        where,
        entities,
        causalRelations,
        contentIndex,
        chunkIndex,
        context,
        metadata);
  }
}
