package com.flamingo.ai.factextraction.service.orchestration;

import com.flamingo.ai.factextraction.config.FactExtractionConfig;
import com.flamingo.ai.factextraction.domain.model.ChunkMetadata;
import com.flamingo.ai.factextraction.domain.model.ContentItem;
import com.flamingo.ai.factextraction.domain.model.ExtractedFact;
import com.flamingo.ai.factextraction.domain.model.ExtractionMode;
import com.flamingo.ai.factextraction.domain.model.FactExtractionResult;
import com.flamingo.ai.factextraction.service.extraction.ChunkFact;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs one {@link TextFactExtractor} task per content item and merges the results in input order,
 * whatever order the tasks finish in.
 *
 * <p>Facts of the same content item are spread out in time: the k-th fact gets {@code k *
 * ordering.seconds-per-fact} added to its timestamps so that their order survives a sort by time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FactExtractionServiceImpl implements FactExtractionService {

  private final TextFactExtractor textFactExtractor;
  private final FactExtractionConfig config;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "fact_extraction.extract", description = "Time to extract facts from a batch")
  public FactExtractionResult extractFacts(
      List<ContentItem> contents, String agentName, ExtractionMode mode) {
    try {
      return extractFactsAsync(contents, agentName, mode).join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      if (e.getCause() instanceof Error error) {
        throw error;
      }
      throw e;
    }
  }

  @Override
  public CompletableFuture<FactExtractionResult> extractFactsAsync(
      List<ContentItem> contents, String agentName, ExtractionMode mode) {
    if (contents == null || contents.isEmpty()) {
      return CompletableFuture.completedFuture(FactExtractionResult.empty());
    }
    log.debug("Extracting {} facts from {} content items", mode, contents.size());

    List<CompletableFuture<List<ChunkExtraction>>> tasks =
        contents.stream()
            .map(content -> textFactExtractor.extract(content, agentName, mode))
            .toList();
    return CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new))
        .thenApply(ignored -> merge(contents, tasks));
  }

  private FactExtractionResult merge(
      List<ContentItem> contents, List<CompletableFuture<List<ChunkExtraction>>> tasks) {
    Duration step = Duration.ofSeconds(config.getOrdering().getSecondsPerFact());
    FactArena arena = new FactArena();
    List<ChunkMetadata> chunks = new ArrayList<>();
    int globalChunkIndex = 0;

    for (int contentIndex = 0; contentIndex < contents.size(); contentIndex++) {
      ContentItem content = contents.get(contentIndex);
      int factInContent = 0;
      for (ChunkExtraction extraction : tasks.get(contentIndex).join()) {
        List<ExtractedFact> facts = new ArrayList<>(extraction.facts().size());
        for (ChunkFact fact : extraction.facts()) {
          facts.add(
              toExtractedFact(fact, contentIndex, globalChunkIndex, content)
                  .shiftedBy(step.multipliedBy(factInContent++)));
        }
        arena.append(facts);
        chunks.add(
            new ChunkMetadata(extraction.chunkText(), facts.size(), contentIndex, globalChunkIndex));
        globalChunkIndex++;
      }
    }

    meterRegistry.counter("fact_extraction.facts.extracted").increment(arena.size());
    log.info(
        "Extracted {} facts from {} chunks across {} content items",
        arena.size(),
        chunks.size(),
        contents.size());
    return new FactExtractionResult(arena.facts(), chunks);
  }

  private static ExtractedFact toExtractedFact(
      ChunkFact fact, int contentIndex, int chunkIndex, ContentItem content) {
    return new ExtractedFact(
        fact.factText(),
        fact.factType(),
        fact.occurredStart(),
        fact.occurredEnd(),
        fact.mentionedAt(),
        fact.where(),
        fact.entities(),
        fact.causalRelations(),
        contentIndex,
        chunkIndex,
        content.context(),
        content.metadata());
  }
}
