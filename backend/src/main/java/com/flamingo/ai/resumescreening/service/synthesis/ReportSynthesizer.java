package com.flamingo.ai.resumescreening.service.synthesis;

import com.flamingo.ai.resumescreening.config.ScreeningConfig;
import com.flamingo.ai.resumescreening.exception.OracleException;
import com.flamingo.ai.resumescreening.report.AnalysisReport;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Turns a job description and resume context into an {@link AnalysisReport}.
 *
 * <p>The oracle reply is repaired and validated; an unavailable oracle, a provider error, a
 * timeout or an unusable reply all produce the deterministic fallback instead. This class never
 * throws to its caller for those cases.
 */
@Service
@Slf4j
public class ReportSynthesizer {

  private static final int RAW_LOG_LIMIT = 500;

  private final TextGenerationOracle oracle;
  private final ReportPromptBuilder promptBuilder;
  private final ReportResponseRepairer responseRepairer;
  private final FallbackReportGenerator fallbackReportGenerator;
  private final Executor oracleExecutor;
  private final MeterRegistry meterRegistry;
  private final GenerationOptions generationOptions;
  private final TimeLimiter timeLimiter;

  public ReportSynthesizer(
      TextGenerationOracle oracle,
      ReportPromptBuilder promptBuilder,
      ReportResponseRepairer responseRepairer,
      FallbackReportGenerator fallbackReportGenerator,
      ScreeningConfig screeningConfig,
      @Qualifier("oracleExecutor") Executor oracleExecutor,
      MeterRegistry meterRegistry) {
    this.oracle = oracle;
    this.promptBuilder = promptBuilder;
    this.responseRepairer = responseRepairer;
    this.fallbackReportGenerator = fallbackReportGenerator;
    this.oracleExecutor = oracleExecutor;
    this.meterRegistry = meterRegistry;

    ScreeningConfig.Synthesis synthesis = screeningConfig.getSynthesis();
    this.generationOptions =
        new GenerationOptions(synthesis.getTemperature(), synthesis.getMaxOutputTokens());
    this.timeLimiter =
        TimeLimiter.of(
            "oracle",
            TimeLimiterConfig.custom()
                .timeoutDuration(synthesis.getTimeout())
                .cancelRunningFuture(true)
                .build());
  }

  /**
   * Synthesizes a report.
   *
   * @param jobDescription the job description
   * @param resumeContext the combined resume evidence
   * @return a schema-valid report, from the oracle or from the fallback
   */
  @Timed(value = "synthesis.synthesize", description = "Time to synthesize a report")
  public AnalysisReport synthesize(String jobDescription, String resumeContext) {
    if (!oracle.isAvailable()) {
      return fallback(jobDescription, resumeContext, "oracle_unavailable");
    }

    String prompt = promptBuilder.build(jobDescription, resumeContext);
    String rawText;
    try {
      rawText =
          timeLimiter.executeFutureSupplier(
              () ->
                  CompletableFuture.supplyAsync(
                      () -> oracle.generate(prompt, generationOptions), oracleExecutor));
    } catch (OracleException e) {
      log.warn("Oracle call failed: {}", e.getMessage());
      return fallback(
          jobDescription, resumeContext, e.isUnavailable() ? "oracle_unavailable" : "oracle_error");
    } catch (TimeoutException e) {
      log.warn(
          "Oracle did not answer within {}",
          timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
      return fallback(jobDescription, resumeContext, "timeout");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for the oracle");
      return fallback(jobDescription, resumeContext, "interrupted");
    } catch (Exception e) {
      log.warn("Oracle call failed: {}", e.getMessage(), e);
      return fallback(jobDescription, resumeContext, "oracle_error");
    }

    RepairResult result = responseRepairer.repair(rawText);
    if (!result.isParsed()) {
      log.warn("Unusable oracle response ({}): {}", result.reason(), abbreviate(result.rawText()));
      return fallback(jobDescription, resumeContext, "malformed_response");
    }
    meterRegistry.counter("synthesis.success").increment();
    return result.report();
  }

  private AnalysisReport fallback(String jobDescription, String resumeContext, String reason) {
    meterRegistry.counter("synthesis.fallback", "reason", reason).increment();
    log.debug("Using fallback report, reason={}", reason);
    return fallbackReportGenerator.fallback(jobDescription, resumeContext);
  }

  private static String abbreviate(String text) {
    if (text == null || text.length() <= RAW_LOG_LIMIT) {
      return text;
    }
    return text.substring(0, RAW_LOG_LIMIT) + "...";
  }
}
