package com.flamingo.ai.resumescreening.model;

/** Outcome of a successful ingestion. */
public record IngestionResult(String documentId, int chunkCount, String filename) {}
