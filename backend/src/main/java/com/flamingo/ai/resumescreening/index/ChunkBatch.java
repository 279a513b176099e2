package com.flamingo.ai.resumescreening.index;

import com.flamingo.ai.resumescreening.exception.ArityMismatchException;
import com.flamingo.ai.resumescreening.exception.EmptyBatchException;
import com.flamingo.ai.resumescreening.model.DocumentMetadata;
import com.flamingo.ai.resumescreening.model.ResumeChunk;
import java.util.ArrayList;
import java.util.List;

/** Validates an upsert batch and turns it into {@link ResumeChunk}s. */
final class ChunkBatch {

  private ChunkBatch() {}

  static List<ResumeChunk> build(
      String documentId,
      List<String> chunks,
      List<List<Float>> embeddings,
      DocumentMetadata metadata) {
    if (chunks == null || chunks.isEmpty() || embeddings == null || embeddings.isEmpty()) {
      throw new EmptyBatchException(documentId);
    }
    if (chunks.size() != embeddings.size()) {
      throw new ArityMismatchException(documentId, chunks.size(), embeddings.size());
    }

    List<ResumeChunk> result = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      result.add(
          ResumeChunk.builder()
              .chunkId(ResumeChunk.chunkId(documentId, i))
              .documentId(documentId)
              .ordinal(i)
              .text(chunks.get(i))
              .embedding(List.copyOf(embeddings.get(i)))
              .filename(metadata.filename())
              .pageCount(metadata.pageCount())
              .ingestedAt(metadata.ingestedAt())
              .build());
    }
    return result;
  }
}
