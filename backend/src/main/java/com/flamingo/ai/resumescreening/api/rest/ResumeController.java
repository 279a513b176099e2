package com.flamingo.ai.resumescreening.api.rest;

import com.flamingo.ai.resumescreening.api.dto.response.ChunkResponse;
import com.flamingo.ai.resumescreening.model.IndexStats;
import com.flamingo.ai.resumescreening.model.IngestionResult;
import com.flamingo.ai.resumescreening.model.ResumeDocument;
import com.flamingo.ai.resumescreening.service.ingestion.ResumeIngestionService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for resume management. */
@RestController
@RequestMapping("/api/resumes")
@RequiredArgsConstructor
public class ResumeController {

  private final ResumeIngestionService ingestionService;

  /** Uploads and ingests a resume. */
  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<IngestionResult> uploadResume(@RequestParam("file") MultipartFile file) {
    IngestionResult result = ingestionService.ingest(file);
    return ResponseEntity.status(HttpStatus.CREATED).body(result);
  }

  @GetMapping
  public ResponseEntity<List<ResumeDocument>> listResumes() {
    return ResponseEntity.ok(ingestionService.listDocuments());
  }

  @GetMapping("/stats")
  public ResponseEntity<IndexStats> stats() {
    return ResponseEntity.ok(ingestionService.stats());
  }

  /** Keyword search over stored chunk text. */
  @GetMapping("/text-search")
  public ResponseEntity<List<ChunkResponse>> textSearch(
      @RequestParam String keyword, @RequestParam(defaultValue = "10") int limit) {
    List<ChunkResponse> chunks =
        ingestionService.searchText(keyword, limit).stream().map(ChunkResponse::fromChunk).toList();
    return ResponseEntity.ok(chunks);
  }

  @GetMapping("/{documentId}/chunks")
  public ResponseEntity<List<ChunkResponse>> getChunks(@PathVariable String documentId) {
    List<ChunkResponse> chunks =
        ingestionService.getChunks(documentId).stream().map(ChunkResponse::fromChunk).toList();
    return ResponseEntity.ok(chunks);
  }

  @DeleteMapping("/{documentId}")
  public ResponseEntity<Void> deleteResume(@PathVariable String documentId) {
    ingestionService.delete(documentId);
    return ResponseEntity.noContent().build();
  }
}
