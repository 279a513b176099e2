package com.flamingo.ai.resumescreening.model;

import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A contiguous text segment of a resume as stored in the vector index.
 *
 * <p>The chunk id is {@code documentId + "_" + ordinal}, so ids are unique and sort with the
 * document's reading order. Filename, page count and ingestion time are the document's base
 * metadata, copied onto every chunk.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ResumeChunk {

  private String chunkId;
  private String documentId;
  private int ordinal;
  private String text;
  private List<Float> embedding;

  private String filename;
  private int pageCount;
  private Instant ingestedAt;

  public static String chunkId(String documentId, int ordinal) {
    return documentId + "_" + ordinal;
  }
}
