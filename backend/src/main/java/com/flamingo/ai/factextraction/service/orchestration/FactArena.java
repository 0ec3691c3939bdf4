package com.flamingo.ai.factextraction.service.orchestration;

import com.flamingo.ai.factextraction.domain.model.CausalRelation;
import com.flamingo.ai.factextraction.domain.model.ExtractedFact;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Append-only sequence of facts in global order. Causal relations are global indices into the
 * sequence and always point at an earlier fact.
 *
 * <p>Not thread-safe; filled by a single thread after all chunk results are available.
 */
@Slf4j
public class FactArena {

  private final List<ExtractedFact> facts = new ArrayList<>();

  /**
   * Appends one chunk's facts. Relation targets are read as indices into {@code chunkFacts},
   * re-based onto the global sequence, and dropped unless they point strictly backwards.
   *
   * @return global index of the first appended fact
   */
  public int append(List<ExtractedFact> chunkFacts) {
    int base = facts.size();
    for (int i = 0; i < chunkFacts.size(); i++) {
      ExtractedFact fact = chunkFacts.get(i);
      int globalIndex = base + i;
      List<CausalRelation> rebased = new ArrayList<>(fact.causalRelations().size());
      for (CausalRelation relation : fact.causalRelations()) {
        int target = relation.targetFactIndex();
        if (target < 0 || base + target >= globalIndex) {
          log.debug("Fact {}: rejecting causal relation to chunk fact {}", globalIndex, target);
          continue;
        }
        rebased.add(relation.withTargetFactIndex(base + target));
      }
      facts.add(fact.withCausalRelations(rebased));
    }
    return base;
  }

  public int size() {
    return facts.size();
  }

  public List<ExtractedFact> facts() {
    return List.copyOf(facts);
  }
}
