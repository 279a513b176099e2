package com.flamingo.ai.resumescreening.exception;

/**
 * Exception thrown when the text-generation oracle cannot produce a reply.
 *
 * <p>Never reaches API callers: the report synthesizer absorbs it into the fallback report.
 */
public class OracleException extends RuntimeException {

  private final boolean unavailable;

  public OracleException(String message, boolean unavailable) {
    super(message);
    this.unavailable = unavailable;
  }

  public OracleException(String message, Throwable cause) {
    super(message, cause);
    this.unavailable = false;
  }

  /** True when no provider is configured or reachable, false for provider-side errors. */
  public boolean isUnavailable() {
    return unavailable;
  }
}
