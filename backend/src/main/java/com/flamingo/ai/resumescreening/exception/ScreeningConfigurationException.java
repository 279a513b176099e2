package com.flamingo.ai.resumescreening.exception;

/** Thrown for invalid settings such as chunk overlap not smaller than chunk size. */
public class ScreeningConfigurationException extends RuntimeException {

  public ScreeningConfigurationException(String message) {
    super(message);
  }
}
