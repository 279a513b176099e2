package com.flamingo.ai.resumescreening.service.synthesis;

/** A language model that turns a prompt into free text. */
public interface TextGenerationOracle {

  /**
   * Generates a reply.
   *
   * @param prompt the full prompt
   * @param options sampling settings
   * @return the raw reply text
   * @throws com.flamingo.ai.resumescreening.exception.OracleException if no model is configured
   *     or the provider call fails
   */
  String generate(String prompt, GenerationOptions options);

  boolean isAvailable();
}
