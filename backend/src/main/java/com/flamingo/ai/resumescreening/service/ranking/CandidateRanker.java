package com.flamingo.ai.resumescreening.service.ranking;

import com.flamingo.ai.resumescreening.exception.EmptyCorpusException;
import com.flamingo.ai.resumescreening.index.VectorIndex;
import com.flamingo.ai.resumescreening.model.ResumeChunk;
import com.flamingo.ai.resumescreening.report.AnalysisReport;
import com.flamingo.ai.resumescreening.service.synthesis.ReportSynthesizer;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Evaluates every ingested resume against one job description and orders the reports.
 *
 * <p>Each document is synthesized from all of its chunks on the ranking executor. Documents without
 * chunks, or whose evaluation throws, are skipped. Output order depends only on the reports' scores
 * and the sorted document ids, never on completion order.
 */
@Service
@Slf4j
public class CandidateRanker {

  private final VectorIndex vectorIndex;
  private final ReportSynthesizer reportSynthesizer;
  private final Executor rankingExecutor;
  private final MeterRegistry meterRegistry;

  public CandidateRanker(
      VectorIndex vectorIndex,
      ReportSynthesizer reportSynthesizer,
      @Qualifier("rankingExecutor") Executor rankingExecutor,
      MeterRegistry meterRegistry) {
    this.vectorIndex = vectorIndex;
    this.reportSynthesizer = reportSynthesizer;
    this.rankingExecutor = rankingExecutor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Ranks all resumes.
   *
   * @param jobDescription the job description
   * @param topKPerDocument accepted for interface compatibility; every chunk is used
   * @param maxDocuments cap on evaluated documents; {@code null} or {@code <= 0} for all
   * @return reports sorted by overall score, highest first; ties keep document id order
   * @throws EmptyCorpusException if no resume is stored
   */
  @Timed(value = "ranking.rankAll", description = "Time to rank all resumes")
  public List<AnalysisReport> rankAll(
      String jobDescription, int topKPerDocument, Integer maxDocuments) {
    List<String> documentIds = vectorIndex.listDocumentIds().stream().sorted().toList();
    if (documentIds.isEmpty()) {
      throw new EmptyCorpusException();
    }
    if (maxDocuments != null && maxDocuments > 0 && documentIds.size() > maxDocuments) {
      documentIds = documentIds.subList(0, maxDocuments);
    }
    log.info("Ranking {} resumes", documentIds.size());

    List<CompletableFuture<Optional<AnalysisReport>>> futures = new ArrayList<>();
    for (String documentId : documentIds) {
      futures.add(
          CompletableFuture.supplyAsync(
                  () -> evaluate(jobDescription, documentId), rankingExecutor)
              .exceptionally(
                  e -> {
                    log.warn("Skipping document {}: {}", documentId, e.getMessage(), e);
                    meterRegistry.counter("ranking.skipped", "reason", "error").increment();
                    return Optional.empty();
                  }));
    }

    List<AnalysisReport> reports = new ArrayList<>();
    for (CompletableFuture<Optional<AnalysisReport>> future : futures) {
      future.join().ifPresent(reports::add);
    }
    // List.sort is stable
    reports.sort(Comparator.comparing(AnalysisReport::overallScore).reversed());
    log.info("Ranked {} of {} resumes", reports.size(), documentIds.size());
    return reports;
  }

  private Optional<AnalysisReport> evaluate(String jobDescription, String documentId) {
    List<ResumeChunk> chunks = vectorIndex.getChunks(documentId);
    if (chunks.isEmpty()) {
      log.warn("Skipping document {}: no chunks", documentId);
      meterRegistry.counter("ranking.skipped", "reason", "no_chunks").increment();
      return Optional.empty();
    }
    String context =
        chunks.stream().map(ResumeChunk::getText).collect(Collectors.joining("\n\n"));
    String filename = chunks.get(0).getFilename();
    AnalysisReport report = reportSynthesizer.synthesize(jobDescription, context);
    log.debug("Document {} scored {}", documentId, report.overallScore());
    return Optional.of(report.withSource(documentId, filename));
  }
}
