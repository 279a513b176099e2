package com.flamingo.ai.resumescreening.exception;

/** Exception thrown when ranking is requested but no resume has been ingested. */
public class EmptyCorpusException extends RuntimeException {

  public EmptyCorpusException() {
    super("No resumes found in the index. Please upload resumes first.");
  }
}
