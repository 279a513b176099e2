package com.flamingo.ai.resumescreening.api.rest;

import com.flamingo.ai.resumescreening.api.dto.request.AnalyzeRequest;
import com.flamingo.ai.resumescreening.api.dto.request.RankRequest;
import com.flamingo.ai.resumescreening.api.dto.request.SearchRequest;
import com.flamingo.ai.resumescreening.exception.NoMatchingChunksException;
import com.flamingo.ai.resumescreening.model.RetrievalHit;
import com.flamingo.ai.resumescreening.report.AnalysisReport;
import com.flamingo.ai.resumescreening.service.screening.ScreeningService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for searching, analyzing and ranking resumes. */
@RestController
@RequestMapping("/api/screening")
@RequiredArgsConstructor
public class ScreeningController {

  private final ScreeningService screeningService;

  @PostMapping("/search")
  public ResponseEntity<List<RetrievalHit>> search(@Valid @RequestBody SearchRequest request) {
    return ResponseEntity.ok(screeningService.search(request.getQuery(), request.getTopK()));
  }

  /** Analyzes the best-matching resume evidence as one combined report. */
  @PostMapping("/analyze")
  public ResponseEntity<AnalysisReport> analyze(@Valid @RequestBody AnalyzeRequest request) {
    AnalysisReport report =
        screeningService
            .analyze(request.getJobDescription(), request.getTopK())
            .orElseThrow(NoMatchingChunksException::new);
    return ResponseEntity.ok(report);
  }

  /** Ranks every resume, best first. */
  @PostMapping("/rank")
  public ResponseEntity<List<AnalysisReport>> rank(@Valid @RequestBody RankRequest request) {
    return ResponseEntity.ok(
        screeningService.rank(
            request.getJobDescription(), request.getTopKPerDocument(), request.getMaxDocuments()));
  }
}
