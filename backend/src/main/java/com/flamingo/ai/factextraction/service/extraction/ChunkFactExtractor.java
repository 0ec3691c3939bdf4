package com.flamingo.ai.factextraction.service.extraction;

import com.flamingo.ai.factextraction.config.FactExtractionConfig;
import com.flamingo.ai.factextraction.llm.LlmClient;
import com.flamingo.ai.factextraction.llm.LlmRequest;
import com.flamingo.ai.factextraction.llm.ValidationMode;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Extracts facts from a single chunk with one structured LLM call, retrying when the response is
 * malformed or needed too many repairs.
 *
 * <p>Provider failures ({@link com.flamingo.ai.factextraction.exception.LlmServiceException}) and
 * truncated output ({@link com.flamingo.ai.factextraction.exception.OutputTooLongException})
 * propagate unchanged. A response that is still malformed after the last attempt yields no facts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChunkFactExtractor {

  private final LlmClient llmClient;
  private final FactEntryNormalizer normalizer;
  private final CausalRelationSanitizer causalRelationSanitizer;
  private final FactExtractionConfig config;
  private final MeterRegistry meterRegistry;

  public List<ChunkFact> extract(ChunkExtractionRequest request) {
    FactExtractionConfig.Extraction settings = config.getExtraction();
    LlmRequest llmRequest = buildLlmRequest(request, settings);
    int maxAttempts = Math.max(1, settings.getMaxAttempts());

    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      boolean lastAttempt = attempt == maxAttempts;
      Object response = llmClient.call(llmRequest);

      List<?> entries = factEntries(response);
      if (entries == null) {
        if (lastAttempt) {
          log.warn(
              "Chunk {}/{}: malformed response after {} attempts, returning no facts",
              request.chunkIndex() + 1,
              request.totalChunks(),
              maxAttempts);
          meterRegistry.counter("fact_extraction.chunk.exhausted").increment();
          return List.of();
        }
        log.warn(
            "Chunk {}/{}: malformed response on attempt {}/{}, retrying",
            request.chunkIndex() + 1,
            request.totalChunks(),
            attempt,
            maxAttempts);
        meterRegistry.counter("fact_extraction.chunk.retries").increment();
        continue;
      }

      ParsedResponse parsed = parse(entries, request);
      double repairRate = (double) parsed.repairs() / entries.size();
      if (repairRate > settings.getRepairRateThreshold() && !lastAttempt) {
        log.warn(
            "Chunk {}/{}: {} of {} entries needed repair on attempt {}/{}, retrying",
            request.chunkIndex() + 1,
            request.totalChunks(),
            parsed.repairs(),
            entries.size(),
            attempt,
            maxAttempts);
        meterRegistry.counter("fact_extraction.chunk.retries").increment();
        continue;
      }

      log.debug(
          "Chunk {}/{}: extracted {} facts ({} skipped)",
          request.chunkIndex() + 1,
          request.totalChunks(),
          parsed.facts().size(),
          parsed.skipped());
      return causalRelationSanitizer.sanitize(parsed.facts());
    }
    // unreachable: the last attempt always returns
    return List.of();
  }

  private LlmRequest buildLlmRequest(
      ChunkExtractionRequest request, FactExtractionConfig.Extraction settings) {
    String chunk = TextSanitizer.removeUnpairedSurrogates(request.chunk());
    String context = TextSanitizer.removeUnpairedSurrogates(request.context());
    String userMessage =
        FactExtractionPrompts.userMessage(
            chunk,
            request.chunkIndex(),
            request.totalChunks(),
            request.eventDate(),
            context,
            request.agentName(),
            request.mode());
    return new LlmRequest(
        List.of(
            SystemMessage.from(FactExtractionPrompts.systemPrompt(request.mode())),
            UserMessage.from(userMessage)),
        FactExtractionSchema.RESPONSE,
        settings.getScope(),
        settings.getTemperature(),
        settings.getMaxOutputTokens(),
        ValidationMode.LENIENT,
        Map.class);
  }

  /** Returns the raw {@code facts} entries, or {@code null} when the response is malformed. */
  private static List<?> factEntries(Object response) {
    if (!(response instanceof Map<?, ?> root)) {
      return null;
    }
    if (!(root.get("facts") instanceof List<?> entries) || entries.isEmpty()) {
      return null;
    }
    return entries;
  }

  private ParsedResponse parse(List<?> entries, ChunkExtractionRequest request) {
    List<ChunkFact> facts = new ArrayList<>(entries.size());
    int skipped = 0;
    int defaulted = 0;
    for (int i = 0; i < entries.size(); i++) {
      EntryParseResult result = normalizer.normalize(entries.get(i), i, request.eventDate());
      if (!result.isParsed()) {
        skipped++;
        continue;
      }
      if (result.repaired()) {
        defaulted++;
      }
      facts.add(result.fact());
    }
    if (skipped > 0) {
      meterRegistry.counter("fact_extraction.entries.skipped").increment(skipped);
    }
    return new ParsedResponse(facts, skipped, skipped + defaulted);
  }

  private record ParsedResponse(List<ChunkFact> facts, int skipped, int repairs) {}
}
