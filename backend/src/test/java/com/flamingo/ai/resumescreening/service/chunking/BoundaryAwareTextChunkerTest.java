package com.flamingo.ai.resumescreening.service.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.resumescreening.exception.ScreeningConfigurationException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("BoundaryAwareTextChunker Tests")
class BoundaryAwareTextChunkerTest {

  private final BoundaryAwareTextChunker chunker = new BoundaryAwareTextChunker();

  /** Text without any break characters, so every cut is a hard boundary. */
  private static String letters(int length) {
    StringBuilder sb = new StringBuilder(length);
    for (int i = 0; i < length; i++) {
      sb.append((char) ('a' + i % 26));
    }
    return sb.toString();
  }

  /** Numbered resume prose mixing sentence ends and line breaks; no sentence repeats. */
  private static String mixedProse() {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < 40; i++) {
      sb.append("Project ").append(i).append(" shipped service ").append(i * 7);
      sb.append(" with Java and Spring.");
      sb.append(i % 3 == 0 ? "\n" : " ");
    }
    return sb.toString().strip();
  }

  @Nested
  @DisplayName("Sliding window")
  class SlidingWindow {

    @Test
    @DisplayName("Should produce three overlapping chunks for 2,500 characters")
    void shouldProduceThreeChunks_when2500Chars() {
      String text = letters(2500);

      List<String> chunks = chunker.chunk(text, 1000, 200);

      assertThat(chunks).hasSize(3);
      assertThat(chunks.get(0)).isEqualTo(text.substring(0, 1000));
      assertThat(chunks.get(1)).isEqualTo(text.substring(800, 1800));
      assertThat(chunks.get(2)).isEqualTo(text.substring(1600));
    }

    @Test
    @DisplayName("Should repeat the overlap at the start of the next chunk")
    void shouldOverlapConsecutiveChunks() {
      List<String> chunks = chunker.chunk(letters(2500), 1000, 200);

      for (int i = 0; i + 1 < chunks.size(); i++) {
        String previous = chunks.get(i);
        String tail = previous.substring(previous.length() - 200);
        assertThat(tail).hasSizeGreaterThanOrEqualTo(150);
        assertThat(chunks.get(i + 1)).startsWith(tail);
      }
    }

    @Test
    @DisplayName("Should return a single chunk when text fits in one window")
    void shouldReturnSingleChunk_whenTextShort() {
      assertThat(chunker.chunk("Senior Java developer.", 1000, 200))
          .containsExactly("Senior Java developer.");
    }

    @Test
    @DisplayName("Should not emit an overlap-only tail chunk")
    void shouldNotEmitTailChunk_whenLastWindowReachesEnd() {
      List<String> chunks = chunker.chunk(letters(1000), 1000, 200);

      assertThat(chunks).hasSize(1);
    }

    @Test
    @DisplayName("Should never exceed chunk size")
    void shouldRespectChunkSize() {
      List<String> chunks = chunker.chunk(letters(5321), 700, 100);

      assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.length()).isLessThanOrEqualTo(700));
    }

    @Test
    @DisplayName("Should cover the original prose in order with only whitespace lost")
    void shouldReconstructText_whenMixedBreaks() {
      String text = mixedProse();

      List<String> chunks = chunker.chunk(text, 120, 30);

      assertThat(chunks).hasSizeGreaterThan(5);
      StringBuilder rebuilt = new StringBuilder();
      int coveredEnd = 0;
      int previousStart = -1;
      for (String chunk : chunks) {
        assertThat(chunk.length()).isLessThanOrEqualTo(120);
        int start = text.indexOf(chunk, previousStart + 1);
        assertThat(start).as("position of %s", chunk).isGreaterThan(previousStart);
        if (start >= coveredEnd) {
          assertThat(text.substring(coveredEnd, start)).isBlank();
          rebuilt.append(' ').append(chunk);
        } else {
          rebuilt.append(chunk.substring(Math.min(chunk.length(), coveredEnd - start)));
        }
        coveredEnd = Math.max(coveredEnd, start + chunk.length());
        previousStart = start;
      }

      assertThat(coveredEnd).isEqualTo(text.length());
      assertThat(rebuilt.toString().replaceAll("\\s+", ""))
          .isEqualTo(text.replaceAll("\\s+", ""));
    }
  }

  @Nested
  @DisplayName("Break points")
  class BreakPoints {

    @Test
    @DisplayName("Should cut after a sentence end beyond 70% of the window")
    void shouldCutAfterPeriod_whenBeyondThreshold() {
      String text = "x".repeat(850) + "." + "y".repeat(1149);

      List<String> chunks = chunker.chunk(text, 1000, 200);

      assertThat(chunks.get(0)).hasSize(851).endsWith(".");
      assertThat(chunks.get(1)).startsWith("x".repeat(199) + ".");
    }

    @Test
    @DisplayName("Should cut after a newline beyond 70% of the window")
    void shouldCutAfterNewline_whenBeyondThreshold() {
      String text = "x".repeat(900) + "\n" + "y".repeat(600);

      List<String> chunks = chunker.chunk(text, 1000, 200);

      assertThat(chunks.get(0)).isEqualTo("x".repeat(900));
    }

    @Test
    @DisplayName("Should ignore a break point before 70% of the window")
    void shouldUseHardBoundary_whenBreakTooEarly() {
      String text = "x".repeat(300) + "." + "y".repeat(1699);

      List<String> chunks = chunker.chunk(text, 1000, 200);

      assertThat(chunks.get(0)).hasSize(1000);
    }
  }

  @Nested
  @DisplayName("Edge cases")
  class EdgeCases {

    @Test
    @DisplayName("Should return no chunks for null or empty text")
    void shouldReturnEmpty_whenTextEmpty() {
      assertThat(chunker.chunk(null, 1000, 200)).isEmpty();
      assertThat(chunker.chunk("", 1000, 200)).isEmpty();
    }

    @Test
    @DisplayName("Should drop chunks that are blank after trimming")
    void shouldDropBlankChunks() {
      String text = "Java".concat(" ".repeat(2000));

      List<String> chunks = chunker.chunk(text, 1000, 200);

      assertThat(chunks).containsExactly("Java");
    }

    @Test
    @DisplayName("Should reject overlap not smaller than size")
    void shouldThrow_whenOverlapNotSmallerThanSize() {
      assertThatThrownBy(() -> chunker.chunk("text", 200, 200))
          .isInstanceOf(ScreeningConfigurationException.class);
      assertThatThrownBy(() -> chunker.chunk("text", 100, 300))
          .isInstanceOf(ScreeningConfigurationException.class);
    }

    @Test
    @DisplayName("Should reject non-positive size and negative overlap")
    void shouldThrow_whenSizeOrOverlapOutOfRange() {
      assertThatThrownBy(() -> chunker.chunk("text", 0, 0))
          .isInstanceOf(ScreeningConfigurationException.class);
      assertThatThrownBy(() -> chunker.chunk("text", 100, -1))
          .isInstanceOf(ScreeningConfigurationException.class);
    }
  }
}
