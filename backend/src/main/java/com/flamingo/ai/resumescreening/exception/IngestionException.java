package com.flamingo.ai.resumescreening.exception;

/**
 * Exception thrown when a resume cannot be ingested.
 *
 * <p>Failures are local to one document; other ingestions are unaffected.
 */
public class IngestionException extends RuntimeException {

  private final String source;
  private final String userMessage;

  public IngestionException(String source, String message) {
    this(source, message, "Failed to ingest resume");
  }

  public IngestionException(String source, String message, Throwable cause) {
    super(message, cause);
    this.source = source;
    this.userMessage = "Failed to ingest resume";
  }

  public IngestionException(String source, String message, String userMessage) {
    super(message);
    this.source = source;
    this.userMessage = userMessage;
  }

  /** The file name or document id the failure relates to. */
  public String getSource() {
    return source;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
