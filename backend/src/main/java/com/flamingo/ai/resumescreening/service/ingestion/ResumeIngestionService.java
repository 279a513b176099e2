package com.flamingo.ai.resumescreening.service.ingestion;

import com.flamingo.ai.resumescreening.config.ScreeningConfig;
import com.flamingo.ai.resumescreening.exception.ArityMismatchException;
import com.flamingo.ai.resumescreening.exception.DocumentNotFoundException;
import com.flamingo.ai.resumescreening.exception.EmptyDocumentException;
import com.flamingo.ai.resumescreening.exception.IngestionException;
import com.flamingo.ai.resumescreening.exception.SearchException;
import com.flamingo.ai.resumescreening.index.VectorIndex;
import com.flamingo.ai.resumescreening.model.DocumentMetadata;
import com.flamingo.ai.resumescreening.model.IndexStats;
import com.flamingo.ai.resumescreening.model.IngestionResult;
import com.flamingo.ai.resumescreening.model.ResumeChunk;
import com.flamingo.ai.resumescreening.model.ResumeDocument;
import com.flamingo.ai.resumescreening.service.chunking.TextChunker;
import com.flamingo.ai.resumescreening.service.embedding.EmbeddingService;
import com.flamingo.ai.resumescreening.service.parsing.DocumentTextExtractor;
import com.flamingo.ai.resumescreening.service.parsing.DocumentTextExtractorRouter;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/**
 * Turns resume files into indexed chunks: extract, chunk, embed, store.
 *
 * <p>Each ingestion gets a fresh document id; a failure leaves nothing behind in the index and does
 * not affect other documents.
 */
@Service
@Slf4j
public class ResumeIngestionService {

  private static final long MAX_UPLOAD_BYTES = 50L * 1024 * 1024;

  private final DocumentTextExtractorRouter extractorRouter;
  private final TextChunker textChunker;
  private final EmbeddingService embeddingService;
  private final VectorIndex vectorIndex;
  private final ScreeningConfig screeningConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Autowired
  public ResumeIngestionService(
      DocumentTextExtractorRouter extractorRouter,
      TextChunker textChunker,
      EmbeddingService embeddingService,
      VectorIndex vectorIndex,
      ScreeningConfig screeningConfig,
      MeterRegistry meterRegistry) {
    this(
        extractorRouter,
        textChunker,
        embeddingService,
        vectorIndex,
        screeningConfig,
        meterRegistry,
        Clock.systemUTC());
  }

  ResumeIngestionService(
      DocumentTextExtractorRouter extractorRouter,
      TextChunker textChunker,
      EmbeddingService embeddingService,
      VectorIndex vectorIndex,
      ScreeningConfig screeningConfig,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.extractorRouter = extractorRouter;
    this.textChunker = textChunker;
    this.embeddingService = embeddingService;
    this.vectorIndex = vectorIndex;
    this.screeningConfig = screeningConfig;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  /** Ingests a file, recording its own file name. */
  public IngestionResult ingest(Path path) {
    Path name = path.getFileName();
    return ingest(path, name == null ? path.toString() : name.toString());
  }

  /**
   * Ingests a file under the given display name.
   *
   * @param path the file to read
   * @param filename the name recorded on every chunk
   * @return the new document id and chunk count
   * @throws IngestionException if the file is missing, unreadable, empty, or cannot be embedded
   */
  @Timed(value = "ingestion.ingest", description = "Time to ingest a resume")
  public IngestionResult ingest(Path path, String filename) {
    try {
      IngestionResult result = doIngest(path, filename);
      meterRegistry.counter("ingestion.success").increment();
      log.info(
          "Ingested resume '{}' as {} with {} chunks",
          filename,
          result.documentId(),
          result.chunkCount());
      return result;
    } catch (RuntimeException e) {
      meterRegistry
          .counter("ingestion.failure", "reason", e.getClass().getSimpleName())
          .increment();
      log.warn("Ingestion of '{}' failed: {}", filename, e.getMessage());
      throw e;
    }
  }

  /**
   * Ingests an uploaded file through a temporary copy that keeps its extension.
   *
   * @param file the upload
   * @return the new document id and chunk count
   */
  public IngestionResult ingest(MultipartFile file) {
    String filename = file.getOriginalFilename();
    if (filename == null || filename.isBlank()) {
      filename = "resume";
    }
    if (file.isEmpty()) {
      throw new IngestionException(filename, "File is empty", "Please upload a non-empty file");
    }
    if (file.getSize() > MAX_UPLOAD_BYTES) {
      throw new IngestionException(
          filename, "File too large: " + file.getSize(), "Maximum file size is 50MB");
    }

    Path tempFile = null;
    try {
      tempFile = Files.createTempFile("resume-", extensionOf(filename));
      try (InputStream in = file.getInputStream()) {
        Files.copy(in, tempFile, StandardCopyOption.REPLACE_EXISTING);
      }
      return ingest(tempFile, filename);
    } catch (IOException e) {
      throw new IngestionException(filename, "Failed to store upload: " + e.getMessage(), e);
    } finally {
      deleteQuietly(tempFile);
    }
  }

  private IngestionResult doIngest(Path path, String filename) {
    if (!Files.isRegularFile(path)) {
      throw new DocumentNotFoundException(path);
    }
    DocumentTextExtractor extractor = extractorRouter.route(path);
    String text = extractor.extractText(path);
    if (text == null || text.isBlank()) {
      throw new EmptyDocumentException(filename);
    }
    int pageCount = extractor.extractPageCount(path);

    ScreeningConfig.Chunking chunking = screeningConfig.getChunking();
    List<String> chunks = textChunker.chunk(text, chunking.getSize(), chunking.getOverlap());
    if (chunks.isEmpty()) {
      throw new EmptyDocumentException(filename);
    }

    String documentId = UUID.randomUUID().toString();
    List<List<Float>> embeddings = embeddingService.embed(chunks);
    if (embeddings.size() != chunks.size()) {
      throw new ArityMismatchException(documentId, chunks.size(), embeddings.size());
    }
    log.debug("Document {}: {} chunks embedded", documentId, chunks.size());

    DocumentMetadata metadata = new DocumentMetadata(filename, pageCount, Instant.now(clock));
    try {
      vectorIndex.upsert(documentId, chunks, embeddings, metadata);
    } catch (SearchException e) {
      removePartialDocument(documentId);
      throw e;
    }
    return new IngestionResult(documentId, chunks.size(), filename);
  }

  /** Removes a resume; unknown ids are ignored. */
  @Timed(value = "ingestion.delete", description = "Time to delete a resume")
  public void delete(String documentId) {
    vectorIndex.delete(documentId);
    meterRegistry.counter("ingestion.deleted").increment();
    log.info("Deleted resume {}", documentId);
  }

  public List<ResumeDocument> listDocuments() {
    return vectorIndex.listDocuments();
  }

  public List<ResumeChunk> getChunks(String documentId) {
    return vectorIndex.getChunks(documentId);
  }

  public IndexStats stats() {
    return vectorIndex.stats();
  }

  public List<ResumeChunk> searchText(String keyword, int limit) {
    if (keyword == null || keyword.isBlank()) {
      throw new IllegalArgumentException("Keyword must not be blank");
    }
    return vectorIndex.searchText(keyword, limit);
  }

  private void removePartialDocument(String documentId) {
    try {
      vectorIndex.delete(documentId);
    } catch (RuntimeException e) {
      log.warn("Could not remove partially stored document {}: {}", documentId, e.getMessage());
    }
  }

  private static String extensionOf(String filename) {
    int dot = filename.lastIndexOf('.');
    return dot >= 0 ? filename.substring(dot).toLowerCase(Locale.ROOT) : ".tmp";
  }

  private static void deleteQuietly(Path path) {
    if (path == null) {
      return;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("Failed to delete temporary file {}: {}", path, e.getMessage());
    }
  }
}
