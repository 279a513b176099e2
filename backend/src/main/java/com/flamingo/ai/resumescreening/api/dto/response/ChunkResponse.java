package com.flamingo.ai.resumescreening.api.dto.response;

import com.flamingo.ai.resumescreening.model.ResumeChunk;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a stored chunk, without its embedding. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkResponse {

  private String chunkId;
  private String documentId;
  private String filename;
  private int ordinal;
  private String text;

  public static ChunkResponse fromChunk(ResumeChunk chunk) {
    return ChunkResponse.builder()
        .chunkId(chunk.getChunkId())
        .documentId(chunk.getDocumentId())
        .filename(chunk.getFilename())
        .ordinal(chunk.getOrdinal())
        .text(chunk.getText())
        .build();
  }
}
