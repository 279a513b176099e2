package com.flamingo.ai.resumescreening.service.synthesis;

/** Sampling settings for one oracle call. */
public record GenerationOptions(double temperature, int maxOutputTokens) {}
