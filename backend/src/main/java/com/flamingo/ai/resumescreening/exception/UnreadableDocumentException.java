package com.flamingo.ai.resumescreening.exception;

/** Exception thrown when a document's format cannot be parsed. */
public class UnreadableDocumentException extends IngestionException {

  public UnreadableDocumentException(String source, String message) {
    super(source, message, "Document could not be read");
  }

  public UnreadableDocumentException(String source, String message, Throwable cause) {
    super(source, message, cause);
  }
}
