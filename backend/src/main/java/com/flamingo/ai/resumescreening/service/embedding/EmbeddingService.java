package com.flamingo.ai.resumescreening.service.embedding;

import com.flamingo.ai.resumescreening.config.ScreeningConfig;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Maps text to fixed-length vectors through the configured LangChain4j {@link EmbeddingModel}.
 *
 * <p>Output has the same size and order as the input. Both entry points carry their own circuit
 * breaker and retry; on repeated failure the fallback returns an empty list, which batch callers
 * treat as an arity mismatch and query callers as a failed embedding.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  private final EmbeddingModel embeddingModel;
  private final ScreeningConfig screeningConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a batch of texts.
   *
   * @param texts texts to embed
   * @return one vector per input text, in input order; empty for empty input
   */
  @Timed(value = "embedding.embedBatch", description = "Time to embed batch")
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedFallback")
  @Retry(name = "embedding")
  public List<List<Float>> embed(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    List<List<Float>> results = embedSegments(texts);
    log.debug("Embedded {} texts", texts.size());
    return results;
  }

  /**
   * Embeds a single text, typically a query.
   *
   * @param text the text to embed
   * @return embedding vector
   */
  @Timed(value = "embedding.embedOne", description = "Time to embed single text")
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedOneFallback")
  @Retry(name = "embedding")
  public List<Float> embedOne(String text) {
    return embedSegments(List.of(text)).get(0);
  }

  private List<List<Float>> embedSegments(List<String> texts) {
    List<TextSegment> segments = new ArrayList<>(texts.size());
    for (int i = 0; i < texts.size(); i++) {
      segments.add(TextSegment.from(truncate(texts.get(i), i)));
    }

    Response<List<Embedding>> response = embeddingModel.embedAll(segments);
    List<List<Float>> results = new ArrayList<>(texts.size());
    for (Embedding embedding : response.content()) {
      results.add(toFloatList(embedding.vector()));
    }
    meterRegistry.counter("embedding.requests.success").increment();
    return results;
  }

  private String truncate(String text, int index) {
    int maxChars = screeningConfig.getEmbedding().getMaxInputChars();
    if (text.length() <= maxChars) {
      return text;
    }
    log.warn(
        "Text {} too long for embedding, truncating from {} chars to {} chars",
        index,
        text.length(),
        maxChars);
    return text.substring(0, maxChars);
  }

  private List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }

  @SuppressWarnings("unused")
  private List<List<Float>> embedFallback(List<String> texts, Throwable t) {
    log.error("Batch embedding of {} texts failed: {}", texts.size(), t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    return List.of();
  }

  @SuppressWarnings("unused")
  private List<Float> embedOneFallback(String text, Throwable t) {
    log.error("Embedding of a {}-char text failed: {}", text.length(), t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    return List.of();
  }
}
