package com.flamingo.ai.resumescreening.model;

import java.time.Instant;

/** Summary of one ingested resume, reconstructed from the metadata shared by its chunks. */
public record ResumeDocument(
    String documentId, String filename, int pageCount, Instant ingestedAt, int chunkCount) {}
