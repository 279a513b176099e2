package com.flamingo.ai.resumescreening.exception;

/**
 * Exception thrown when the vector index or query embedding fails.
 *
 * <p>Surfaces as 503; the caller may retry the same request.
 */
public class SearchException extends RuntimeException {

  static final String USER_MESSAGE = "The resume index is temporarily unavailable. Please retry.";

  public SearchException(String message) {
    super(message);
  }

  public SearchException(String message, Throwable cause) {
    super(message, cause);
  }

  public String getUserMessage() {
    return USER_MESSAGE;
  }
}
