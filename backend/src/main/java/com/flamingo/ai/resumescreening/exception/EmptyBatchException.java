package com.flamingo.ai.resumescreening.exception;

/** Exception thrown when an upsert carries no chunks or no embeddings. */
public class EmptyBatchException extends IngestionException {

  public EmptyBatchException(String documentId) {
    super(documentId, "Chunks and embeddings cannot be empty for document " + documentId);
  }
}
