package com.flamingo.ai.resumescreening.exception;

/** Exception thrown when no text could be extracted from a document. */
public class EmptyDocumentException extends IngestionException {

  public EmptyDocumentException(String source) {
    super(source, "No text extracted from " + source, "No text could be extracted from the resume");
  }
}
