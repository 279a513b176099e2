package com.flamingo.ai.resumescreening.service.parsing;

import com.flamingo.ai.resumescreening.exception.DocumentNotFoundException;
import com.flamingo.ai.resumescreening.exception.UnreadableDocumentException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * {@link DocumentTextExtractor} for PDF resumes, using Apache PDFBox 3.x.
 *
 * <p>Text is extracted page by page and joined with newlines, so page breaks act as chunk break
 * candidates.
 */
@Component
@Order(10)
@Slf4j
public class PdfBoxDocumentTextExtractor implements DocumentTextExtractor {

  @Override
  public boolean supports(Path path) {
    return path.getFileName() != null
        && path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf");
  }

  @Override
  public String extractText(Path path) {
    try (PDDocument pdf = load(path)) {
      PDFTextStripper stripper = new PDFTextStripper();
      StringBuilder text = new StringBuilder();
      for (int page = 1; page <= pdf.getNumberOfPages(); page++) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        String pageText = stripper.getText(pdf);
        if (pageText != null && !pageText.isBlank()) {
          text.append(pageText.strip()).append('\n');
        }
      }
      log.debug(
          "Extracted {} chars from {} pages of {}", text.length(), pdf.getNumberOfPages(), path);
      return text.toString().strip();
    } catch (IOException e) {
      log.error("PDFBox text extraction failed for {}: {}", path, e.getMessage());
      throw new UnreadableDocumentException(
          path.toString(), "Failed to parse PDF: " + e.getMessage(), e);
    }
  }

  @Override
  public int extractPageCount(Path path) {
    try (PDDocument pdf = load(path)) {
      return pdf.getNumberOfPages();
    } catch (IOException e) {
      throw new UnreadableDocumentException(
          path.toString(), "Failed to read PDF page count: " + e.getMessage(), e);
    }
  }

  private PDDocument load(Path path) throws IOException {
    if (!Files.isRegularFile(path)) {
      throw new DocumentNotFoundException(path);
    }
    return Loader.loadPDF(path.toFile());
  }
}
