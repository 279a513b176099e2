package com.flamingo.ai.resumescreening.service.parsing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.resumescreening.exception.DocumentNotFoundException;
import com.flamingo.ai.resumescreening.exception.IngestionException;
import com.flamingo.ai.resumescreening.exception.UnreadableDocumentException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("Document text extractor Tests")
class DocumentTextExtractorTest {

  @TempDir Path tempDir;

  private final PdfBoxDocumentTextExtractor pdfExtractor = new PdfBoxDocumentTextExtractor();
  private final PlainTextDocumentTextExtractor textExtractor =
      new PlainTextDocumentTextExtractor();
  private final DocumentTextExtractorRouter router =
      new DocumentTextExtractorRouter(List.of(pdfExtractor, textExtractor));

  private Path writePdf(String name, String... pages) throws IOException {
    Path file = tempDir.resolve(name);
    try (PDDocument document = new PDDocument()) {
      for (String pageText : pages) {
        PDPage page = new PDPage();
        document.addPage(page);
        try (PDPageContentStream content = new PDPageContentStream(document, page)) {
          content.beginText();
          content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
          content.newLineAtOffset(72, 700);
          content.showText(pageText);
          content.endText();
        }
      }
      document.save(file.toFile());
    }
    return file;
  }

  @Nested
  @DisplayName("Routing")
  class Routing {

    @Test
    @DisplayName("Should route PDF and text files to their extractors")
    void shouldRouteByExtension() {
      assertThat(router.route(Path.of("cv.PDF"))).isSameAs(pdfExtractor);
      assertThat(router.route(Path.of("cv.txt"))).isSameAs(textExtractor);
      assertThat(router.route(Path.of("cv.md"))).isSameAs(textExtractor);
    }

    @Test
    @DisplayName("Should reject unsupported file types as unreadable")
    void shouldThrowUnreadable_whenTypeUnsupported() {
      assertThatThrownBy(() -> router.route(Path.of("cv.docx")))
          .isInstanceOf(UnreadableDocumentException.class)
          .isInstanceOf(IngestionException.class);
    }
  }

  @Nested
  @DisplayName("PDF extraction")
  class PdfExtraction {

    @Test
    @DisplayName("Should extract text of every page and count pages")
    void shouldExtractAllPages() throws IOException {
      Path pdf = writePdf("resume.pdf", "Jane Doe Java Engineer", "Skills Python Kafka");

      String text = pdfExtractor.extractText(pdf);

      assertThat(text).contains("Jane Doe Java Engineer").contains("Skills Python Kafka");
      assertThat(text.indexOf("Jane")).isLessThan(text.indexOf("Skills"));
      assertThat(pdfExtractor.extractPageCount(pdf)).isEqualTo(2);
    }

    @Test
    @DisplayName("Should report a missing file as not found")
    void shouldThrowNotFound_whenFileMissing() {
      Path missing = tempDir.resolve("missing.pdf");

      assertThatThrownBy(() -> pdfExtractor.extractText(missing))
          .isInstanceOf(DocumentNotFoundException.class);
    }

    @Test
    @DisplayName("Should report a corrupt PDF as unreadable")
    void shouldThrowUnreadable_whenPdfCorrupt() throws IOException {
      Path corrupt = tempDir.resolve("corrupt.pdf");
      Files.writeString(corrupt, "this is not a pdf");

      assertThatThrownBy(() -> pdfExtractor.extractText(corrupt))
          .isInstanceOf(UnreadableDocumentException.class);
    }
  }

  @Nested
  @DisplayName("Plain text extraction")
  class PlainTextExtraction {

    @Test
    @DisplayName("Should read UTF-8 text trimmed, as one page")
    void shouldReadTrimmedText() throws IOException {
      Path file = tempDir.resolve("resume.txt");
      Files.writeString(file, "\n  José Álvarez, data engineer  \n", StandardCharsets.UTF_8);

      assertThat(textExtractor.extractText(file)).isEqualTo("José Álvarez, data engineer");
      assertThat(textExtractor.extractPageCount(file)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should report a missing file as not found")
    void shouldThrowNotFound_whenFileMissing() {
      assertThatThrownBy(() -> textExtractor.extractText(tempDir.resolve("none.txt")))
          .isInstanceOf(DocumentNotFoundException.class);
    }

    @Test
    @DisplayName("Should report invalid UTF-8 as unreadable")
    void shouldThrowUnreadable_whenNotUtf8() throws IOException {
      Path file = tempDir.resolve("latin1.txt");
      Files.write(file, new byte[] {(byte) 0xC3, (byte) 0x28, (byte) 0xFF});

      assertThatThrownBy(() -> textExtractor.extractText(file))
          .isInstanceOf(UnreadableDocumentException.class);
    }
  }
}
