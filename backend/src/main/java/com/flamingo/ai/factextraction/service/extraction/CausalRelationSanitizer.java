package com.flamingo.ai.factextraction.service.extraction;

import com.flamingo.ai.factextraction.config.FactExtractionConfig;
import com.flamingo.ai.factextraction.domain.model.CausalRelation;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Cleans causal relations within one chunk's fact list so that every target points at an earlier
 * fact of the same chunk.
 *
 * <p>LLMs occasionally number facts from 1. When no relation targets 0, the smallest target is at
 * least 1 and the largest equals the fact count, all targets are shifted down by one before
 * filtering.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CausalRelationSanitizer {

  static final String REASON_OUT_OF_BOUNDS = "out_of_bounds";
  static final String REASON_FORWARD_OR_SELF = "forward_or_self";

  private final FactExtractionConfig config;
  private final MeterRegistry meterRegistry;

  public List<ChunkFact> sanitize(List<ChunkFact> facts) {
    if (facts.isEmpty()) {
      return facts;
    }
    int factCount = facts.size();
    int shift = looksOneBased(facts) ? 1 : 0;
    if (shift == 1) {
      log.debug("Causal relation targets look 1-based, converting to 0-based");
    }

    int kept = 0;
    int outOfBounds = 0;
    int forwardOrSelf = 0;
    List<ChunkFact> sanitized = new ArrayList<>(factCount);
    for (int i = 0; i < factCount; i++) {
      ChunkFact fact = facts.get(i);
      if (fact.causalRelations().isEmpty()) {
        sanitized.add(fact);
        continue;
      }
      List<CausalRelation> valid = new ArrayList<>();
      for (CausalRelation relation : fact.causalRelations()) {
        int target = relation.targetFactIndex() - shift;
        if (target < 0 || target >= factCount) {
          outOfBounds++;
          log.debug("Fact {}: dropping causal relation to out-of-range fact {}", i, target);
        } else if (target >= i) {
          forwardOrSelf++;
          log.debug("Fact {}: dropping causal relation to non-earlier fact {}", i, target);
        } else {
          valid.add(relation.withTargetFactIndex(target));
        }
      }
      kept += valid.size();
      sanitized.add(fact.withCausalRelations(valid));
    }

    count(REASON_OUT_OF_BOUNDS, outOfBounds);
    count(REASON_FORWARD_OR_SELF, forwardOrSelf);
    if (config.getCausal().isDebugLogging()) {
      log.info(
          "Causal relations: {} kept, {} out of bounds, {} forward or self, 1-based={}",
          kept,
          outOfBounds,
          forwardOrSelf,
          shift == 1);
    } else if (outOfBounds + forwardOrSelf > 0) {
      log.debug(
          "Causal relations: {} kept, {} dropped", kept, outOfBounds + forwardOrSelf);
    }
    return sanitized;
  }

  private static boolean looksOneBased(List<ChunkFact> facts) {
    int min = Integer.MAX_VALUE;
    int max = Integer.MIN_VALUE;
    boolean any = false;
    for (ChunkFact fact : facts) {
      for (CausalRelation relation : fact.causalRelations()) {
        int target = relation.targetFactIndex();
        min = Math.min(min, target);
        max = Math.max(max, target);
        any = true;
      }
    }
    return any && min >= 1 && max == facts.size();
  }

  private void count(String reason, int amount) {
    if (amount > 0) {
      meterRegistry.counter("fact_extraction.causal.dropped", "reason", reason).increment(amount);
    }
  }
}
