package com.flamingo.ai.resumescreening.index;

import com.flamingo.ai.resumescreening.model.DocumentMetadata;
import com.flamingo.ai.resumescreening.model.ResumeChunk;
import com.flamingo.ai.resumescreening.model.RetrievalHit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * {@link VectorIndex} held in process memory, searched by brute-force cosine distance.
 *
 * <p>Each document's chunks are replaced atomically as one immutable list. Ties in distance are
 * broken by chunk id so query results are deterministic.
 */
@Service
@ConditionalOnProperty(name = "screening.vector-index.type", havingValue = "in-memory")
@Slf4j
public class InMemoryVectorIndex implements VectorIndex {

  private final Map<String, List<ResumeChunk>> documents = new ConcurrentHashMap<>();

  @Override
  public void upsert(
      String documentId,
      List<String> chunks,
      List<List<Float>> embeddings,
      DocumentMetadata metadata) {
    List<ResumeChunk> batch = ChunkBatch.build(documentId, chunks, embeddings, metadata);
    documents.put(documentId, List.copyOf(batch));
    log.debug("Stored {} chunks for document {}", batch.size(), documentId);
  }

  @Override
  public List<RetrievalHit> query(List<Float> embedding, int topK, Map<String, Object> filter) {
    if (topK <= 0) {
      return List.of();
    }
    List<RetrievalHit> hits = new ArrayList<>();
    for (List<ResumeChunk> chunks : documents.values()) {
      for (ResumeChunk chunk : chunks) {
        if (matches(chunk, filter)) {
          hits.add(RetrievalHit.of(chunk, cosineDistance(embedding, chunk.getEmbedding())));
        }
      }
    }
    return hits.stream()
        .sorted(
            Comparator.comparingDouble(RetrievalHit::distance)
                .thenComparing(RetrievalHit::chunkId))
        .limit(topK)
        .toList();
  }

  @Override
  public List<ResumeChunk> getChunks(String documentId) {
    List<ResumeChunk> chunks = documents.getOrDefault(documentId, List.of());
    return chunks.stream()
        .sorted(Comparator.comparingInt(ResumeChunk::getOrdinal))
        .map(InMemoryVectorIndex::copyWithoutEmbedding)
        .toList();
  }

  @Override
  public void delete(String documentId) {
    documents.remove(documentId);
  }

  @Override
  public Set<String> listDocumentIds() {
    return Set.copyOf(documents.keySet());
  }

  @Override
  public List<ResumeChunk> searchText(String keyword, int limit) {
    if (keyword == null || keyword.isBlank() || limit <= 0) {
      return List.of();
    }
    String needle = keyword.toLowerCase(Locale.ROOT);
    return documents.values().stream()
        .flatMap(List::stream)
        .filter(chunk -> chunk.getText().toLowerCase(Locale.ROOT).contains(needle))
        .sorted(Comparator.comparing(ResumeChunk::getChunkId))
        .limit(limit)
        .map(InMemoryVectorIndex::copyWithoutEmbedding)
        .toList();
  }

  @Override
  public String type() {
    return "in-memory";
  }

  static double cosineDistance(List<Float> a, List<Float> b) {
    if (a.size() != b.size()) {
      throw new IllegalArgumentException(
          "Embedding dimension mismatch: " + a.size() + " vs " + b.size());
    }
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.size(); i++) {
      double x = a.get(i);
      double y = b.get(i);
      dot += x * y;
      normA += x * x;
      normB += y * y;
    }
    if (normA == 0.0 || normB == 0.0) {
      return 1.0;
    }
    return Math.max(0.0, 1.0 - dot / (Math.sqrt(normA) * Math.sqrt(normB)));
  }

  private static boolean matches(ResumeChunk chunk, Map<String, Object> filter) {
    if (filter == null || filter.isEmpty()) {
      return true;
    }
    for (Map.Entry<String, Object> entry : filter.entrySet()) {
      String expected = String.valueOf(entry.getValue());
      String actual =
          switch (entry.getKey()) {
            case FILTER_DOCUMENT_ID -> chunk.getDocumentId();
            case FILTER_FILENAME -> chunk.getFilename();
            default ->
                throw new IllegalArgumentException("Unsupported filter field: " + entry.getKey());
          };
      if (!Objects.equals(expected, actual)) {
        return false;
      }
    }
    return true;
  }

  private static ResumeChunk copyWithoutEmbedding(ResumeChunk chunk) {
    return chunk.toBuilder().embedding(null).build();
  }
}
