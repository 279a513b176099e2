package com.flamingo.ai.resumescreening.exception;

import java.nio.file.Path;

/** Exception thrown when a document path does not resolve to a file. */
public class DocumentNotFoundException extends IngestionException {

  public DocumentNotFoundException(Path path) {
    super(String.valueOf(path), "Document not found: " + path, "Document not found");
  }
}
