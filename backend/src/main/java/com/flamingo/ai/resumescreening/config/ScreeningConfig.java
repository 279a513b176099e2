package com.flamingo.ai.resumescreening.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the screening pipeline. */
@Configuration
@ConfigurationProperties(prefix = "screening")
@Getter
@Setter
public class ScreeningConfig {

  private Chunking chunking = new Chunking();
  private Retrieval retrieval = new Retrieval();
  private Synthesis synthesis = new Synthesis();
  private Ranking ranking = new Ranking();
  private VectorIndex vectorIndex = new VectorIndex();
  private Llm llm = new Llm();
  private Embedding embedding = new Embedding();

  @Getter
  @Setter
  public static class Chunking {
    private int size = 1000;
    private int overlap = 200;
  }

  @Getter
  @Setter
  public static class Retrieval {
    /** Chunks retrieved across the whole corpus for single-context analysis. */
    private int topK = 5;

    private int topKPerDocument = 3;

    /** Upper bound accepted from callers for any top-k parameter. */
    private int maxTopK = 50;
  }

  @Getter
  @Setter
  public static class Synthesis {
    private double temperature = 0.3;
    private int maxOutputTokens = 8192;

    /** Budget for one oracle call; exceeding it is treated like a malformed response. */
    private Duration timeout = Duration.ofSeconds(60);
  }

  @Getter
  @Setter
  public static class Ranking {
    /** Worker threads for per-document synthesis during ranking. */
    private int parallelism = 4;

    private int queueCapacity = 500;

    /** Default document cap for ranking requests; 0 means every document. */
    private int maxDocuments = 0;
  }

  @Getter
  @Setter
  public static class VectorIndex {
    /** "elasticsearch" (default) or "in-memory". */
    private String type = "elasticsearch";

    private String indexName = "resume-chunks";

    /** Must match the embedding model; 384 for all-MiniLM-L6-v2. */
    private int dimensions = 384;
  }

  @Getter
  @Setter
  public static class Llm {
    /** "openai", "ollama", "gemini" or "none". */
    private String provider = "openai";

    private String modelName = "gpt-4o-mini";
    private String apiKey = "";
    private String baseUrl = "http://localhost:11434";

    /** Fail at startup instead of running fallback-only when the API key is missing. */
    private boolean requireCredentials = false;

    private Duration timeout = Duration.ofSeconds(60);
  }

  @Getter
  @Setter
  public static class Embedding {
    /** "local" (all-MiniLM-L6-v2, in-process) or "openai". */
    private String provider = "local";

    private String modelName = "text-embedding-3-small";
    private String apiKey = "";
    private int maxInputChars = 5000;
  }
}
