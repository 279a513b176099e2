package com.flamingo.ai.resumescreening.service.parsing;

import com.flamingo.ai.resumescreening.exception.DocumentNotFoundException;
import com.flamingo.ai.resumescreening.exception.UnreadableDocumentException;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** {@link DocumentTextExtractor} for UTF-8 plain text and Markdown resumes. */
@Component
@Order(20)
public class PlainTextDocumentTextExtractor implements DocumentTextExtractor {

  private static final Set<String> EXTENSIONS = Set.of(".txt", ".md", ".markdown");

  @Override
  public boolean supports(Path path) {
    if (path.getFileName() == null) {
      return false;
    }
    String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
    return EXTENSIONS.stream().anyMatch(name::endsWith);
  }

  @Override
  public String extractText(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new DocumentNotFoundException(path);
    }
    try {
      return Files.readString(path, StandardCharsets.UTF_8).strip();
    } catch (CharacterCodingException e) {
      throw new UnreadableDocumentException(path.toString(), "File is not valid UTF-8 text", e);
    } catch (IOException e) {
      throw new UnreadableDocumentException(
          path.toString(), "Failed to read text file: " + e.getMessage(), e);
    }
  }

  @Override
  public int extractPageCount(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new DocumentNotFoundException(path);
    }
    return 1;
  }
}
