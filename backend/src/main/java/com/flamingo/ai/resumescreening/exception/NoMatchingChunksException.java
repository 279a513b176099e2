package com.flamingo.ai.resumescreening.exception;

/** Exception thrown by the API when an analysis query matched no resume chunk. */
public class NoMatchingChunksException extends RuntimeException {

  public NoMatchingChunksException() {
    super("No relevant resume chunks found. Please upload resumes first.");
  }
}
