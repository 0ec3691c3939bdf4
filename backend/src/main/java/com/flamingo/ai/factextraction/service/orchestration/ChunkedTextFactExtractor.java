package com.flamingo.ai.factextraction.service.orchestration;

import com.flamingo.ai.factextraction.config.FactExtractionConfig;
import com.flamingo.ai.factextraction.domain.model.ContentItem;
import com.flamingo.ai.factextraction.domain.model.ExtractionMode;
import com.flamingo.ai.factextraction.service.chunking.TextChunker;
import com.flamingo.ai.factextraction.service.extraction.AutoSplitFactExtractor;
import com.flamingo.ai.factextraction.service.extraction.ChunkExtractionRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Chunks a content item and extracts every chunk concurrently. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChunkedTextFactExtractor implements TextFactExtractor {

  private final TextChunker textChunker;
  private final AutoSplitFactExtractor autoSplitFactExtractor;
  private final FactExtractionConfig config;

  @Override
  public CompletableFuture<List<ChunkExtraction>> extract(
      ContentItem content, String agentName, ExtractionMode mode) {
    List<String> chunks = textChunker.chunk(content.text(), config.getChunking().getMaxChars());
    if (chunks.isEmpty()) {
      return CompletableFuture.completedFuture(List.of());
    }
    log.debug("Extracting facts from {} chunks", chunks.size());

    List<CompletableFuture<ChunkExtraction>> tasks = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      String chunk = chunks.get(i);
      ChunkExtractionRequest request =
          new ChunkExtractionRequest(
              chunk, i, chunks.size(), content.eventDate(), content.context(), agentName, mode);
      tasks.add(
          autoSplitFactExtractor
              .extract(request)
              .thenApply(facts -> new ChunkExtraction(chunk, facts)));
    }
    return CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new))
        .thenApply(ignored -> tasks.stream().map(CompletableFuture::join).toList());
  }
}
