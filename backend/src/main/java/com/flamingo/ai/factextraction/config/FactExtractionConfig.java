package com.flamingo.ai.factextraction.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the fact extraction pipeline. */
@Configuration
@ConfigurationProperties(prefix = "fact-extraction")
@Getter
@Setter
public class FactExtractionConfig {

  private Chunking chunking = new Chunking();
  private Extraction extraction = new Extraction();
  private AutoSplit autoSplit = new AutoSplit();
  private Ordering ordering = new Ordering();
  private Causal causal = new Causal();
  private Executor executor = new Executor();

  @Getter
  @Setter
  public static class Chunking {
    /** Maximum characters per chunk sent to the LLM (~750 tokens for English text). */
    private int maxChars = 3000;
  }

  @Getter
  @Setter
  public static class Extraction {
    /** Total LLM attempts per chunk for malformed responses, including the first call. */
    private int maxAttempts = 2;

    /** Share of repaired or skipped entries above which a response is requested again. */
    private double repairRateThreshold = 0.2;

    private double temperature = 0.1;
    private int maxOutputTokens = 65000;
    private int maxCausalRelationsPerFact = 2;

    /** Scope tag attached to every extraction call. */
    private String scope = "memory_extract_facts";
  }

  @Getter
  @Setter
  public static class AutoSplit {
    /** Fraction of the chunk length searched on each side of the midpoint for a boundary. */
    private double searchWindowRatio = 0.2;

    /**
     * Chunks shorter than this that still overflow the output budget are not split again and fail
     * the extraction.
     */
    private int minChunkChars = 200;
  }

  @Getter
  @Setter
  public static class Ordering {
    /** Synthetic offset between consecutive facts of the same content item. */
    private long secondsPerFact = 10;
  }

  @Getter
  @Setter
  public static class Causal {
    /** Logs per-chunk causal relation statistics at INFO instead of DEBUG. */
    private boolean debugLogging = false;
  }

  @Getter
  @Setter
  public static class Executor {
    private int corePoolSize = 4;
    private int maxPoolSize = 16;
    private int queueCapacity = 500;
  }
}
