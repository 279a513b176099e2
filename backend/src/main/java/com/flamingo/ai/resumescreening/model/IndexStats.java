package com.flamingo.ai.resumescreening.model;

/** Aggregate counters of the vector index. */
public record IndexStats(int totalDocuments, long totalChunks, String indexType) {}
