package com.flamingo.ai.factextraction.service.extraction;

import com.flamingo.ai.factextraction.domain.model.CausalRelation;
import com.flamingo.ai.factextraction.domain.model.FactType;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * A fact parsed from one chunk's LLM response. Causal relation targets are indices into the same
 * chunk's fact list.
 */
public record ChunkFact(
    String factText,
    FactType factType,
    OffsetDateTime occurredStart,
    OffsetDateTime occurredEnd,
    OffsetDateTime mentionedAt,
    String where,
    List<String> entities,
    List<CausalRelation> causalRelations) {

  public ChunkFact {
    entities = entities != null ? List.copyOf(entities) : List.of();
    causalRelations = causalRelations != null ? List.copyOf(causalRelations) : List.of();
  }

  public ChunkFact withCausalRelations(List<CausalRelation> relations) {
    return new ChunkFact(
        factText, factType, occurredStart, occurredEnd, mentionedAt, where, entities, relations);
  }
}
