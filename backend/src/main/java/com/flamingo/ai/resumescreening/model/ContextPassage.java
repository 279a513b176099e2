package com.flamingo.ai.resumescreening.model;

/** A retrieved chunk text with its relevance, as used in a {@link CandidateContext}. */
public record ContextPassage(String text, Double relevanceScore) {}
