package com.flamingo.ai.factextraction.service.extraction;

import com.flamingo.ai.factextraction.config.FactExtractionConfig;
import com.flamingo.ai.factextraction.exception.FactExtractionException;
import com.flamingo.ai.factextraction.exception.OutputTooLongException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs {@link ChunkFactExtractor} asynchronously and recovers from truncated LLM output by splitting
 * the chunk in two and extracting both halves concurrently.
 *
 * <p>Splits prefer sentence and paragraph boundaries near the middle of the chunk. A chunk shorter
 * than {@code auto-split.min-chunk-chars} that still overflows fails with {@link
 * FactExtractionException}.
 */
@Service
@Slf4j
public class AutoSplitFactExtractor {

  private static final List<String> BOUNDARIES = List.of(". ", "! ", "? ", "\n\n");
  private static final int MIN_SPLITTABLE_CHARS = 2;

  private final ChunkFactExtractor chunkFactExtractor;
  private final FactExtractionConfig config;
  private final MeterRegistry meterRegistry;
  private final Executor executor;

  public AutoSplitFactExtractor(
      ChunkFactExtractor chunkFactExtractor,
      FactExtractionConfig config,
      MeterRegistry meterRegistry,
      @Qualifier("factExtractionExecutor") Executor executor) {
    this.chunkFactExtractor = chunkFactExtractor;
    this.config = config;
    this.meterRegistry = meterRegistry;
    this.executor = executor;
  }

  public CompletableFuture<List<ChunkFact>> extract(ChunkExtractionRequest request) {
    return CompletableFuture.supplyAsync(() -> chunkFactExtractor.extract(request), executor)
        .exceptionallyCompose(
            error -> {
              Throwable cause = unwrap(error);
              if (cause instanceof OutputTooLongException tooLong) {
                return splitAndExtract(request, tooLong);
              }
              return CompletableFuture.failedFuture(cause);
            });
  }

  private CompletableFuture<List<ChunkFact>> splitAndExtract(
      ChunkExtractionRequest request, OutputTooLongException cause) {
    String chunk = request.chunk();
    int minChunkChars = Math.max(MIN_SPLITTABLE_CHARS, config.getAutoSplit().getMinChunkChars());
    if (chunk.length() < minChunkChars) {
      log.error(
          "Chunk {}/{} still exceeds the output budget at {} chars, cannot split further",
          request.chunkIndex() + 1,
          request.totalChunks(),
          chunk.length());
      return CompletableFuture.failedFuture(
          new FactExtractionException(
              request.chunkIndex(),
              "Chunk of " + chunk.length() + " chars exceeds the LLM output budget",
              cause));
    }

    int splitPoint = findSplitPoint(chunk, config.getAutoSplit().getSearchWindowRatio());
    String left = chunk.substring(0, splitPoint).trim();
    String right = chunk.substring(splitPoint).trim();
    meterRegistry.counter("fact_extraction.autosplit.splits").increment();
    log.info(
        "Chunk {}/{} output too long, splitting {} chars into {} + {}",
        request.chunkIndex() + 1,
        request.totalChunks(),
        chunk.length(),
        left.length(),
        right.length());

    return extractPart(request, left)
        .thenCombine(
            extractPart(request, right),
            (leftFacts, rightFacts) -> {
              List<ChunkFact> combined = new ArrayList<>(leftFacts.size() + rightFacts.size());
              combined.addAll(leftFacts);
              combined.addAll(rightFacts);
              return combined;
            });
  }

  private CompletableFuture<List<ChunkFact>> extractPart(
      ChunkExtractionRequest request, String part) {
    if (part.isEmpty()) {
      return CompletableFuture.completedFuture(List.of());
    }
    return extract(request.withChunk(part));
  }

  /**
   * Picks the split offset: just after the boundary nearest the midpoint, trying each boundary kind
   * in preference order within {@code ratio} of the length on either side; the exact midpoint when
   * none is found.
   */
  static int findSplitPoint(String chunk, double ratio) {
    int mid = chunk.length() / 2;
    int radius = (int) (chunk.length() * ratio);
    int windowStart = Math.max(0, mid - radius);
    int windowEnd = Math.min(chunk.length(), mid + radius);

    for (String boundary : BOUNDARIES) {
      int best = -1;
      int bestDistance = Integer.MAX_VALUE;
      int pos = chunk.indexOf(boundary, windowStart);
      while (pos >= 0 && pos + boundary.length() <= windowEnd) {
        int distance = Math.abs(pos - mid);
        if (distance < bestDistance) {
          best = pos;
          bestDistance = distance;
        }
        pos = chunk.indexOf(boundary, pos + 1);
      }
      if (best >= 0) {
        return best + boundary.length();
      }
    }
    return mid;
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }
}
