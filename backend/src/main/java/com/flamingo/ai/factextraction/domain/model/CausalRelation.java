package com.flamingo.ai.factextraction.domain.model;

/**
 * Directed causal link from the fact holding it to an earlier fact.
 *
 * @param targetFactIndex index of the target fact; chunk-local while a chunk is being parsed,
 *     pipeline-global once the fact is part of a {@link FactExtractionResult}
 * @param relationType kind of link
 * @param strength 1.0 for direct causation, 0.5 moderate, 0.3 weak or indirect
 */
public record CausalRelation(int targetFactIndex, CausalRelationType relationType, double strength) {

  public static final double DEFAULT_STRENGTH = 1.0;

  public CausalRelation withTargetFactIndex(int newTarget) {
    return new CausalRelation(newTarget, relationType, strength);
  }
}
