package com.flamingo.ai.resumescreening.service.chunking;

import java.util.List;

/**
 * Splits normalized document text into overlapping segments ready for embedding.
 *
 * <p>Implementations must be stateless and safe for concurrent use.
 */
public interface TextChunker {

  /**
   * Produces chunks from the given text.
   *
   * @param text the document text; {@code null} or empty yields no chunks
   * @param chunkSize maximum characters per chunk
   * @param chunkOverlap characters repeated between consecutive chunks
   * @return ordered, non-empty chunk texts
   * @throws com.flamingo.ai.resumescreening.exception.ScreeningConfigurationException if {@code
   *     chunkOverlap >= chunkSize} or either value is out of range
   */
  List<String> chunk(String text, int chunkSize, int chunkOverlap);
}
