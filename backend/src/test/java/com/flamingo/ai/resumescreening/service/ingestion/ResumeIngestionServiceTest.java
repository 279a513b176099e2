package com.flamingo.ai.resumescreening.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.resumescreening.config.ScreeningConfig;
import com.flamingo.ai.resumescreening.exception.ArityMismatchException;
import com.flamingo.ai.resumescreening.exception.DocumentNotFoundException;
import com.flamingo.ai.resumescreening.exception.EmptyDocumentException;
import com.flamingo.ai.resumescreening.exception.IngestionException;
import com.flamingo.ai.resumescreening.exception.SearchException;
import com.flamingo.ai.resumescreening.exception.UnreadableDocumentException;
import com.flamingo.ai.resumescreening.index.InMemoryVectorIndex;
import com.flamingo.ai.resumescreening.index.VectorIndex;
import com.flamingo.ai.resumescreening.model.IngestionResult;
import com.flamingo.ai.resumescreening.model.ResumeChunk;
import com.flamingo.ai.resumescreening.model.ResumeDocument;
import com.flamingo.ai.resumescreening.service.chunking.BoundaryAwareTextChunker;
import com.flamingo.ai.resumescreening.service.embedding.EmbeddingService;
import com.flamingo.ai.resumescreening.service.parsing.DocumentTextExtractorRouter;
import com.flamingo.ai.resumescreening.service.parsing.PdfBoxDocumentTextExtractor;
import com.flamingo.ai.resumescreening.service.parsing.PlainTextDocumentTextExtractor;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;

@ExtendWith(MockitoExtension.class)
@DisplayName("ResumeIngestionService Tests")
class ResumeIngestionServiceTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  @TempDir Path tempDir;

  @Mock private EmbeddingModel embeddingModel;

  private InMemoryVectorIndex vectorIndex;
  private SimpleMeterRegistry meterRegistry;
  private ScreeningConfig config;
  private DocumentTextExtractorRouter router;
  private ResumeIngestionService ingestionService;

  @BeforeEach
  void setUp() {
    vectorIndex = new InMemoryVectorIndex();
    meterRegistry = new SimpleMeterRegistry();
    config = new ScreeningConfig();
    router =
        new DocumentTextExtractorRouter(
            List.of(new PdfBoxDocumentTextExtractor(), new PlainTextDocumentTextExtractor()));
    ingestionService = newService(vectorIndex);
  }

  private ResumeIngestionService newService(VectorIndex index) {
    EmbeddingService embeddingService =
        new EmbeddingService(embeddingModel, config, meterRegistry);
    return new ResumeIngestionService(
        router,
        new BoundaryAwareTextChunker(),
        embeddingService,
        index,
        config,
        meterRegistry,
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private void embedEverySegment() {
    when(embeddingModel.embedAll(anyList()))
        .thenAnswer(
            invocation -> {
              List<TextSegment> segments = invocation.getArgument(0);
              return Response.from(
                  segments.stream()
                      .map(s -> Embedding.from(new float[] {s.text().length(), 1.0f}))
                      .toList());
            });
  }

  private Path writeText(String name, String content) throws IOException {
    Path file = tempDir.resolve(name);
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file;
  }

  @Nested
  @DisplayName("Successful ingestion")
  class Success {

    @Test
    @DisplayName("Should chunk, embed and store a text resume")
    void shouldIngestTextResume() throws IOException {
      embedEverySegment();
      Path file = writeText("jane.txt", "x".repeat(2500));

      IngestionResult result = ingestionService.ingest(file);

      assertThat(result.filename()).isEqualTo("jane.txt");
      assertThat(result.chunkCount()).isEqualTo(3);
      List<ResumeChunk> chunks = vectorIndex.getChunks(result.documentId());
      assertThat(chunks).hasSize(3);
      assertThat(chunks)
          .allSatisfy(
              chunk -> {
                assertThat(chunk.getFilename()).isEqualTo("jane.txt");
                assertThat(chunk.getPageCount()).isEqualTo(1);
                assertThat(chunk.getIngestedAt()).isEqualTo(NOW);
              });
      assertThat(meterRegistry.counter("ingestion.success").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should assign a new document id to each ingestion of the same file")
    void shouldAssignFreshIds() throws IOException {
      embedEverySegment();
      Path file = writeText("jane.txt", "Java engineer with Kafka experience.");

      IngestionResult first = ingestionService.ingest(file);
      IngestionResult second = ingestionService.ingest(file);

      assertThat(first.documentId()).isNotEqualTo(second.documentId());
      assertThat(ingestionService.listDocuments())
          .extracting(ResumeDocument::documentId)
          .containsExactlyInAnyOrder(first.documentId(), second.documentId());
    }

    @Test
    @DisplayName("Should ingest an upload under its original file name")
    void shouldIngestUpload() {
      embedEverySegment();
      MockMultipartFile upload =
          new MockMultipartFile(
              "file",
              "bob.md",
              "text/markdown",
              "# Bob\nPython developer".getBytes(StandardCharsets.UTF_8));

      IngestionResult result = ingestionService.ingest(upload);

      assertThat(result.filename()).isEqualTo("bob.md");
      assertThat(ingestionService.getChunks(result.documentId()))
          .singleElement()
          .extracting(ResumeChunk::getText)
          .isEqualTo("# Bob\nPython developer");
    }

    @Test
    @DisplayName("Should delete a stored resume")
    void shouldDeleteResume() throws IOException {
      embedEverySegment();
      IngestionResult result =
          ingestionService.ingest(writeText("jane.txt", "Java engineer with Kafka."));

      ingestionService.delete(result.documentId());

      assertThat(ingestionService.listDocuments()).isEmpty();
      assertThat(ingestionService.stats().totalChunks()).isZero();
      assertThat(meterRegistry.counter("ingestion.deleted").count()).isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("Failures")
  class Failures {

    @Test
    @DisplayName("Should reject a missing file")
    void shouldRejectMissingFile() {
      assertThatThrownBy(() -> ingestionService.ingest(tempDir.resolve("nope.pdf")))
          .isInstanceOf(DocumentNotFoundException.class);
      assertThat(
              meterRegistry
                  .counter("ingestion.failure", "reason", "DocumentNotFoundException")
                  .count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject a file with only whitespace")
    void shouldRejectEmptyDocument() throws IOException {
      Path file = writeText("blank.txt", "   \n\t  ");

      assertThatThrownBy(() -> ingestionService.ingest(file))
          .isInstanceOf(EmptyDocumentException.class);
      assertThat(vectorIndex.listDocumentIds()).isEmpty();
    }

    @Test
    @DisplayName("Should reject an unsupported file type")
    void shouldRejectUnsupportedType() throws IOException {
      Path file = writeText("resume.docx", "not really a docx");

      assertThatThrownBy(() -> ingestionService.ingest(file))
          .isInstanceOf(UnreadableDocumentException.class);
    }

    @Test
    @DisplayName("Should reject an empty upload")
    void shouldRejectEmptyUpload() {
      MockMultipartFile upload =
          new MockMultipartFile("file", "empty.pdf", "application/pdf", new byte[0]);

      assertThatThrownBy(() -> ingestionService.ingest(upload))
          .isInstanceOf(IngestionException.class)
          .hasMessage("File is empty");
    }

    @Test
    @DisplayName("Should fail with an arity mismatch when embeddings are missing")
    void shouldRejectMissingEmbeddings() throws IOException {
      when(embeddingModel.embedAll(anyList())).thenReturn(Response.from(List.of()));
      Path file = writeText("jane.txt", "Java engineer with Kafka.");

      assertThatThrownBy(() -> ingestionService.ingest(file))
          .isInstanceOfSatisfying(
              ArityMismatchException.class,
              e -> {
                assertThat(e.getChunkCount()).isEqualTo(1);
                assertThat(e.getEmbeddingCount()).isZero();
              });
      assertThat(vectorIndex.listDocumentIds()).isEmpty();
    }

    @Test
    @DisplayName("Should remove partially stored chunks when the index write fails")
    void shouldRollBackOnIndexFailure() throws IOException {
      embedEverySegment();
      VectorIndex failingIndex = mock(VectorIndex.class);
      doThrow(new SearchException("bulk failed"))
          .when(failingIndex)
          .upsert(anyString(), anyList(), anyList(), any());
      ResumeIngestionService service = newService(failingIndex);
      Path file = writeText("jane.txt", "Java engineer with Kafka.");

      assertThatThrownBy(() -> service.ingest(file)).isInstanceOf(SearchException.class);
      verify(failingIndex).delete(anyString());
    }

    @Test
    @DisplayName("Should reject a blank keyword search")
    void shouldRejectBlankKeyword() {
      assertThatThrownBy(() -> ingestionService.searchText(" ", 10))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }
}
