package com.flamingo.ai.resumescreening.exception;

/** Exception thrown when chunk and embedding counts differ for one document. */
public class ArityMismatchException extends IngestionException {

  private final int chunkCount;
  private final int embeddingCount;

  public ArityMismatchException(String documentId, int chunkCount, int embeddingCount) {
    super(
        documentId,
        String.format(
            "Number of chunks (%d) must match number of embeddings (%d)",
            chunkCount, embeddingCount));
    this.chunkCount = chunkCount;
    this.embeddingCount = embeddingCount;
  }

  public int getChunkCount() {
    return chunkCount;
  }

  public int getEmbeddingCount() {
    return embeddingCount;
  }
}
