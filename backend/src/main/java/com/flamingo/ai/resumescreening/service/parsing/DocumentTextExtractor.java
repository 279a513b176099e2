package com.flamingo.ai.resumescreening.service.parsing;

import java.nio.file.Path;

/**
 * Extracts plain text from a resume file.
 *
 * <p>Implementations are format-specific and stateless. They never chunk or embed.
 */
public interface DocumentTextExtractor {

  /**
   * Returns {@code true} if this extractor can handle the given file.
   *
   * @param path the document path
   * @return {@code true} if supported
   */
  boolean supports(Path path);

  /**
   * Extracts the full text of the document.
   *
   * @param path the document path
   * @return the extracted text, trimmed; may be empty
   * @throws com.flamingo.ai.resumescreening.exception.DocumentNotFoundException if the path does
   *     not resolve
   * @throws com.flamingo.ai.resumescreening.exception.UnreadableDocumentException if the format
   *     cannot be parsed
   */
  String extractText(Path path);

  /**
   * Counts the pages of the document.
   *
   * @param path the document path
   * @return number of pages
   */
  int extractPageCount(Path path);
}
