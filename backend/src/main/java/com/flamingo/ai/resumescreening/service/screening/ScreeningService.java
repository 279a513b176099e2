package com.flamingo.ai.resumescreening.service.screening;

import com.flamingo.ai.resumescreening.config.ScreeningConfig;
import com.flamingo.ai.resumescreening.exception.SearchException;
import com.flamingo.ai.resumescreening.index.VectorIndex;
import com.flamingo.ai.resumescreening.model.CandidateContext;
import com.flamingo.ai.resumescreening.model.RetrievalHit;
import com.flamingo.ai.resumescreening.report.AnalysisReport;
import com.flamingo.ai.resumescreening.service.embedding.EmbeddingService;
import com.flamingo.ai.resumescreening.service.ranking.CandidateRanker;
import com.flamingo.ai.resumescreening.service.retrieval.RetrievalAggregator;
import com.flamingo.ai.resumescreening.service.synthesis.ReportSynthesizer;
import io.micrometer.core.annotation.Timed;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Entry point for searching, analyzing and ranking resumes against a job description. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScreeningService {

  private final EmbeddingService embeddingService;
  private final VectorIndex vectorIndex;
  private final RetrievalAggregator retrievalAggregator;
  private final ReportSynthesizer reportSynthesizer;
  private final CandidateRanker candidateRanker;
  private final ScreeningConfig screeningConfig;

  /**
   * Finds the chunks most similar to a query.
   *
   * @param query free text, typically keywords or a job description
   * @param topK number of hits; {@code null} for the configured default
   * @return hits, best first
   */
  @Timed(value = "screening.search", description = "Time to search resumes")
  public List<RetrievalHit> search(String query, Integer topK) {
    requireText(query, "Query");
    int k = resolveTopK(topK, screeningConfig.getRetrieval().getTopK());
    return vectorIndex.query(embedQuery(query), k, null);
  }

  /**
   * Analyzes the resume evidence most relevant to a job description as one combined context.
   *
   * @param jobDescription the job description
   * @param topK number of chunks retrieved across all resumes; {@code null} for the default
   * @return the report, or empty when no chunk matched
   */
  @Timed(value = "screening.analyze", description = "Time to analyze resumes")
  public Optional<AnalysisReport> analyze(String jobDescription, Integer topK) {
    requireText(jobDescription, "Job description");
    int k = resolveTopK(topK, screeningConfig.getRetrieval().getTopK());

    List<RetrievalHit> hits = vectorIndex.query(embedQuery(jobDescription), k, null);
    if (hits.isEmpty()) {
      log.info("No resume chunks matched the job description");
      return Optional.empty();
    }

    LinkedHashMap<String, CandidateContext> contexts = retrievalAggregator.aggregate(hits);
    log.debug("Analyzing {} hits from {} resumes", hits.size(), contexts.size());
    String context = retrievalAggregator.combinedContext(contexts.values());
    AnalysisReport report = reportSynthesizer.synthesize(jobDescription, context);

    if (contexts.size() == 1) {
      CandidateContext only = contexts.values().iterator().next();
      report = report.withSource(only.documentId(), only.filename());
    }
    return Optional.of(report);
  }

  /**
   * Ranks every resume against a job description.
   *
   * @param jobDescription the job description
   * @param topKPerDocument chunks per resume; {@code null} for the default
   * @param maxDocuments document cap; {@code null} for the configured default, {@code <= 0} for all
   * @return reports, highest overall score first
   */
  @Timed(value = "screening.rank", description = "Time to rank resumes")
  public List<AnalysisReport> rank(
      String jobDescription, Integer topKPerDocument, Integer maxDocuments) {
    requireText(jobDescription, "Job description");
    int k = resolveTopK(topKPerDocument, screeningConfig.getRetrieval().getTopKPerDocument());
    Integer cap =
        maxDocuments != null ? maxDocuments : screeningConfig.getRanking().getMaxDocuments();
    return candidateRanker.rankAll(jobDescription, k, cap);
  }

  private List<Float> embedQuery(String text) {
    List<Float> embedding = embeddingService.embedOne(text);
    if (embedding.isEmpty()) {
      throw new SearchException("Failed to embed query");
    }
    return embedding;
  }

  private int resolveTopK(Integer requested, int defaultValue) {
    if (requested == null) {
      return defaultValue;
    }
    int max = screeningConfig.getRetrieval().getMaxTopK();
    if (requested < 1 || requested > max) {
      throw new IllegalArgumentException("topK must be between 1 and " + max);
    }
    return requested;
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
  }
}
