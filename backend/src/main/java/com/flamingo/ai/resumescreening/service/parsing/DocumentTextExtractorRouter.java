package com.flamingo.ai.resumescreening.service.parsing;

import com.flamingo.ai.resumescreening.exception.UnreadableDocumentException;
import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Routes a file to the highest-priority {@link DocumentTextExtractor} that supports it.
 *
 * <p>Extractors are injected by Spring in {@code @Order} order (ascending).
 */
@Service
@RequiredArgsConstructor
public class DocumentTextExtractorRouter {

  private final List<DocumentTextExtractor> extractors;

  /**
   * Returns the first extractor supporting the file.
   *
   * @param path the document path
   * @return selected extractor
   * @throws UnreadableDocumentException if no extractor supports the file type
   */
  public DocumentTextExtractor route(Path path) {
    return extractors.stream()
        .filter(e -> e.supports(path))
        .findFirst()
        .orElseThrow(
            () ->
                new UnreadableDocumentException(
                    String.valueOf(path.getFileName()), "Unsupported document type: " + path));
  }
}
