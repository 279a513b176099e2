package com.flamingo.ai.resumescreening.model;

/**
 * One row of a similarity query.
 *
 * @param distance cosine distance, smaller is more similar
 * @param relevanceScore {@code 1 - distance} when the distance lies in [0,1], otherwise null
 */
public record RetrievalHit(
    String chunkId,
    String documentId,
    String filename,
    int ordinal,
    String text,
    double distance,
    Double relevanceScore) {

  public static RetrievalHit of(ResumeChunk chunk, double distance) {
    Double relevance = distance >= 0.0 && distance <= 1.0 ? 1.0 - distance : null;
    return new RetrievalHit(
        chunk.getChunkId(),
        chunk.getDocumentId(),
        chunk.getFilename(),
        chunk.getOrdinal(),
        chunk.getText(),
        distance,
        relevance);
  }
}
