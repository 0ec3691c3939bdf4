package com.flamingo.ai.factextraction.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atMost;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.factextraction.config.FactExtractionConfig;
import com.flamingo.ai.factextraction.domain.model.ExtractionMode;
import com.flamingo.ai.factextraction.domain.model.FactType;
import com.flamingo.ai.factextraction.exception.FactExtractionException;
import com.flamingo.ai.factextraction.exception.LlmServiceException;
import com.flamingo.ai.factextraction.exception.OutputTooLongException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AutoSplitFactExtractorTest {

  private static final OffsetDateTime EVENT_DATE =
      OffsetDateTime.of(2024, 6, 15, 14, 30, 0, 0, ZoneOffset.UTC);

  @Mock private ChunkFactExtractor chunkFactExtractor;

  private FactExtractionConfig config;
  private SimpleMeterRegistry meterRegistry;
  private AutoSplitFactExtractor extractor;

  @BeforeEach
  void setUp() {
    config = new FactExtractionConfig();
    meterRegistry = new SimpleMeterRegistry();
    extractor =
        new AutoSplitFactExtractor(chunkFactExtractor, config, meterRegistry, Runnable::run);
  }

  private static ChunkExtractionRequest request(String chunk) {
    return new ChunkExtractionRequest(chunk, 3, 7, EVENT_DATE, "ctx", null, ExtractionMode.FACTS);
  }

  private static ChunkFact fact(String text) {
    return new ChunkFact(text, FactType.WORLD, null, null, EVENT_DATE, null, List.of(), List.of());
  }

  private static OutputTooLongException tooLong() {
    return new OutputTooLongException("memory_extract_facts", 65000);
  }

  @Nested
  @DisplayName("extract")
  class ExtractTests {

    @Test
    @DisplayName("should return the worker's facts when the output fits")
    void shouldPassThroughFacts() {
      when(chunkFactExtractor.extract(any())).thenReturn(List.of(fact("a"), fact("b")));

      List<ChunkFact> facts = extractor.extract(request("short chunk")).join();

      assertThat(facts).extracting(ChunkFact::factText).containsExactly("a", "b");
    }

    @Test
    @DisplayName("should split an overflowing chunk and concatenate left then right")
    void shouldSplitAndConcatenate() {
      String left = "Alice went hiking in the Alps with her brother on a sunny day".repeat(2) + ".";
      String right = "Bob stayed at home and read three novels about the sea".repeat(2) + ".";
      String chunk = left + " " + right;
      when(chunkFactExtractor.extract(any()))
          .thenAnswer(
              invocation -> {
                ChunkExtractionRequest req = invocation.getArgument(0);
                if (req.chunk().equals(chunk)) {
                  throw tooLong();
                }
                return List.of(fact(req.chunk()));
              });

      List<ChunkFact> facts = extractor.extract(request(chunk)).join();

      assertThat(facts).extracting(ChunkFact::factText).containsExactly(left, right);
      assertThat(meterRegistry.counter("fact_extraction.autosplit.splits").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should keep the chunk position on sub-requests")
    void shouldKeepChunkPosition() {
      String chunk = "x".repeat(150) + ". " + "y".repeat(150);
      when(chunkFactExtractor.extract(any()))
          .thenThrow(tooLong())
          .thenReturn(List.of())
          .thenReturn(List.of());

      extractor.extract(request(chunk)).join();

      ArgumentCaptor<ChunkExtractionRequest> captor =
          ArgumentCaptor.forClass(ChunkExtractionRequest.class);
      verify(chunkFactExtractor, times(3)).extract(captor.capture());
      assertThat(captor.getAllValues())
          .extracting(ChunkExtractionRequest::chunk)
          .containsExactly(chunk, "x".repeat(150) + ".", "y".repeat(150));
      assertThat(captor.getAllValues())
          .allSatisfy(
              sub -> {
                assertThat(sub.chunkIndex()).isEqualTo(3);
                assertThat(sub.totalChunks()).isEqualTo(7);
                assertThat(sub.context()).isEqualTo("ctx");
              });
    }

    @Test
    @DisplayName("should not call the LLM for a blank half")
    void shouldSkipBlankHalf() {
      String chunk = " ".repeat(100) + "y".repeat(100);
      when(chunkFactExtractor.extract(any()))
          .thenThrow(tooLong())
          .thenReturn(List.of(fact("from right")));

      List<ChunkFact> facts = extractor.extract(request(chunk)).join();

      assertThat(facts).extracting(ChunkFact::factText).containsExactly("from right");
      verify(chunkFactExtractor, times(2)).extract(any());
    }

    @Test
    @DisplayName("should fail when a chunk below the split floor still overflows")
    void shouldFailBelowFloor() {
      when(chunkFactExtractor.extract(any())).thenThrow(tooLong());

      CompletableFuture<List<ChunkFact>> future = extractor.extract(request("z".repeat(150)));

      assertThatThrownBy(future::join)
          .isInstanceOf(CompletionException.class)
          .hasCauseInstanceOf(FactExtractionException.class);
    }

    @Test
    @DisplayName("should terminate when every call overflows")
    void shouldTerminateForUnsplittableInput() {
      when(chunkFactExtractor.extract(any())).thenThrow(tooLong());

      CompletableFuture<List<ChunkFact>> future =
          extractor.extract(request("word ".repeat(400)));

      assertThatThrownBy(future::join).hasCauseInstanceOf(FactExtractionException.class);
      verify(chunkFactExtractor, atMost(64)).extract(any());
    }

    @Test
    @DisplayName("should propagate provider errors unchanged")
    void shouldPropagateProviderErrors() {
      LlmServiceException failure = new LlmServiceException("provider down");
      when(chunkFactExtractor.extract(any())).thenThrow(failure);

      CompletableFuture<List<ChunkFact>> future = extractor.extract(request("text"));

      assertThatThrownBy(future::join).isInstanceOf(CompletionException.class).hasCause(failure);
    }

    @Test
    @DisplayName("should not starve a single worker thread when splitting recursively")
    void shouldNotBlockPoolThreads() throws Exception {
      ExecutorService pool = Executors.newSingleThreadExecutor();
      try {
        AutoSplitFactExtractor pooled =
            new AutoSplitFactExtractor(chunkFactExtractor, config, meterRegistry, pool);
        when(chunkFactExtractor.extract(any()))
            .thenAnswer(
                invocation -> {
                  ChunkExtractionRequest req = invocation.getArgument(0);
                  if (req.chunk().length() > 300) {
                    throw tooLong();
                  }
                  return List.of(fact(req.chunk()));
                });

        String chunk = "The quick brown fox jumps over the lazy dog. ".repeat(30);
        List<ChunkFact> facts = pooled.extract(request(chunk)).get(10, TimeUnit.SECONDS);

        assertThat(facts).isNotEmpty();
        assertThat(facts).allSatisfy(f -> assertThat(f.factText()).hasSizeLessThanOrEqualTo(300));
        assertThat(String.join(" ", facts.stream().map(ChunkFact::factText).toList()))
            .isEqualTo(chunk.trim());
      } finally {
        pool.shutdownNow();
      }
    }
  }

  @Nested
  @DisplayName("findSplitPoint")
  class FindSplitPointTests {

    @Test
    @DisplayName("should split just after a sentence boundary near the middle")
    void shouldSplitAfterSentenceBoundary() {
      String chunk = "a".repeat(40) + ". " + "b".repeat(40);

      assertThat(AutoSplitFactExtractor.findSplitPoint(chunk, 0.2)).isEqualTo(42);
    }

    @Test
    @DisplayName("should pick the occurrence nearest the midpoint")
    void shouldPickNearestOccurrence() {
      String chunk = "x".repeat(35) + ". " + "x".repeat(10) + ". " + "x".repeat(51);

      assertThat(AutoSplitFactExtractor.findSplitPoint(chunk, 0.2)).isEqualTo(49);
    }

    @Test
    @DisplayName("should prefer earlier boundary kinds over nearer later ones")
    void shouldPreferBoundaryOrder() {
      String chunk = "x".repeat(38) + ". " + "x".repeat(9) + "\n\n" + "x".repeat(49);

      assertThat(AutoSplitFactExtractor.findSplitPoint(chunk, 0.2)).isEqualTo(40);
    }

    @Test
    @DisplayName("should ignore boundaries outside the search window")
    void shouldIgnoreBoundariesOutsideWindow() {
      String chunk = "a. " + "b".repeat(47) + "\n\n" + "c".repeat(48);

      assertThat(AutoSplitFactExtractor.findSplitPoint(chunk, 0.2)).isEqualTo(52);
    }

    @Test
    @DisplayName("should fall back to the exact midpoint")
    void shouldFallBackToMidpoint() {
      assertThat(AutoSplitFactExtractor.findSplitPoint("x".repeat(100), 0.2)).isEqualTo(50);
    }
  }
}
