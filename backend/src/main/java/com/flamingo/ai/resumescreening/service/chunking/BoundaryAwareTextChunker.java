package com.flamingo.ai.resumescreening.service.chunking;

import com.flamingo.ai.resumescreening.exception.ScreeningConfigurationException;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Sliding-window {@link TextChunker} that prefers sentence or line boundaries.
 *
 * <p>Each window is {@code chunkSize} characters. A window that does not reach the end of the
 * text is cut after its rightmost {@code '.'} or newline when that break lies beyond 70% of the
 * window; otherwise it is cut at the hard boundary. The next window starts {@code chunkOverlap}
 * characters before the previous end. The window that reaches the end of the text is the last.
 */
@Component
public class BoundaryAwareTextChunker implements TextChunker {

  static final double MIN_BREAK_RATIO = 0.7;

  @Override
  public List<String> chunk(String text, int chunkSize, int chunkOverlap) {
    validate(chunkSize, chunkOverlap);
    if (text == null || text.isEmpty()) {
      return List.of();
    }

    List<String> chunks = new ArrayList<>();
    int length = text.length();
    int start = 0;

    while (start < length) {
      int end = Math.min(start + chunkSize, length);

      if (end < length) {
        int breakPoint = findBreakPoint(text, start, end);
        if (breakPoint > start && breakPoint - start > chunkSize * MIN_BREAK_RATIO) {
          end = breakPoint + 1;
        }
      }

      String chunk = text.substring(start, end).strip();
      if (!chunk.isEmpty()) {
        chunks.add(chunk);
      }

      if (end >= length) {
        break;
      }
      // never step backwards, even when a semantic break pulls the end close to the start
      start = Math.max(end - chunkOverlap, start + 1);
    }

    return chunks;
  }

  private int findBreakPoint(String text, int start, int end) {
    for (int i = end - 1; i >= start; i--) {
      char c = text.charAt(i);
      if (c == '.' || c == '\n') {
        return i;
      }
    }
    return -1;
  }

  private void validate(int chunkSize, int chunkOverlap) {
    if (chunkSize <= 0) {
      throw new ScreeningConfigurationException(
          "chunkSize must be positive (got " + chunkSize + ")");
    }
    if (chunkOverlap < 0) {
      throw new ScreeningConfigurationException(
          "chunkOverlap must be >= 0 (got " + chunkOverlap + ")");
    }
    if (chunkOverlap >= chunkSize) {
      throw new ScreeningConfigurationException(
          "chunkOverlap (" + chunkOverlap + ") must be < chunkSize (" + chunkSize + ")");
    }
  }
}
