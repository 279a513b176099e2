package com.flamingo.ai.resumescreening.service.synthesis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.resumescreening.config.ScreeningConfig;
import com.flamingo.ai.resumescreening.exception.OracleException;
import com.flamingo.ai.resumescreening.report.AnalysisReport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReportSynthesizer Tests")
class ReportSynthesizerTest {

  private static final String JOB = "Senior Java engineer with Kafka";
  private static final String CONTEXT = "[Resume: jane.pdf]\nJava, Kafka and python scripting";

  @Mock private TextGenerationOracle oracle;

  private final FallbackReportGenerator fallbackGenerator = new FallbackReportGenerator();
  private SimpleMeterRegistry meterRegistry;
  private ExecutorService executor;
  private ReportSynthesizer synthesizer;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    executor = Executors.newSingleThreadExecutor();
    ScreeningConfig config = new ScreeningConfig();
    config.getSynthesis().setTimeout(Duration.ofMillis(300));
    ReportResponseRepairer repairer =
        new ReportResponseRepairer(
            new ObjectMapper(),
            new ReportValidator(Validation.buildDefaultValidatorFactory().getValidator()));
    synthesizer =
        new ReportSynthesizer(
            oracle,
            new ReportPromptBuilder(),
            repairer,
            fallbackGenerator,
            config,
            executor,
            meterRegistry);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private double fallbackCount(String reason) {
    return meterRegistry.counter("synthesis.fallback", "reason", reason).count();
  }

  @Test
  @DisplayName("Should return the parsed oracle report")
  void shouldReturnOracleReport_whenReplyValid() {
    when(oracle.isAvailable()).thenReturn(true);
    when(oracle.generate(anyString(), any()))
        .thenReturn("```json\n" + ReportResponseRepairerTest.VALID_JSON + "```");

    AnalysisReport report = synthesizer.synthesize(JOB, CONTEXT);

    assertThat(report.candidateName()).isEqualTo("Jane Doe");
    assertThat(report.overallScore()).isEqualTo(0.82);
    assertThat(meterRegistry.counter("synthesis.success").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should send job description, context and generation options to the oracle")
  void shouldBuildPromptAndOptions() {
    when(oracle.isAvailable()).thenReturn(true);
    when(oracle.generate(anyString(), any())).thenReturn(ReportResponseRepairerTest.VALID_JSON);

    synthesizer.synthesize(JOB, CONTEXT);

    ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
    ArgumentCaptor<GenerationOptions> options = ArgumentCaptor.forClass(GenerationOptions.class);
    verify(oracle).generate(prompt.capture(), options.capture());
    assertThat(prompt.getValue())
        .contains(JOB)
        .contains(CONTEXT)
        .contains("overall_score")
        .contains("education_matches")
        .endsWith("Return ONLY valid JSON, no additional text.");
    assertThat(options.getValue()).isEqualTo(new GenerationOptions(0.3, 8192));
  }

  @Test
  @DisplayName("Should fall back without calling an unavailable oracle")
  void shouldFallBack_whenOracleUnavailable() {
    when(oracle.isAvailable()).thenReturn(false);

    AnalysisReport report = synthesizer.synthesize(JOB, CONTEXT);

    assertThat(report).isEqualTo(fallbackGenerator.fallback(JOB, CONTEXT));
    verify(oracle, never()).generate(anyString(), any());
    assertThat(fallbackCount("oracle_unavailable")).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should fall back when the oracle fails")
  void shouldFallBack_whenOracleThrows() {
    when(oracle.isAvailable()).thenReturn(true);
    when(oracle.generate(anyString(), any()))
        .thenThrow(new OracleException("rate limited", new RuntimeException("429")));

    AnalysisReport report = synthesizer.synthesize(JOB, CONTEXT);

    assertThat(report).isEqualTo(fallbackGenerator.fallback(JOB, CONTEXT));
    assertThat(fallbackCount("oracle_error")).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should fall back when the reply is not JSON")
  void shouldFallBack_whenReplyMalformed() {
    when(oracle.isAvailable()).thenReturn(true);
    when(oracle.generate(anyString(), any())).thenReturn("I cannot help with that");

    AnalysisReport report = synthesizer.synthesize(JOB, CONTEXT);

    assertThat(report.overallScore()).isEqualTo(0.75);
    assertThat(fallbackCount("malformed_response")).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should fall back when the oracle exceeds the timeout")
  void shouldFallBack_whenOracleTimesOut() {
    when(oracle.isAvailable()).thenReturn(true);
    when(oracle.generate(anyString(), any()))
        .thenAnswer(
            invocation -> {
              Thread.sleep(5_000);
              return ReportResponseRepairerTest.VALID_JSON;
            });

    AnalysisReport report = synthesizer.synthesize(JOB, CONTEXT);

    assertThat(report).isEqualTo(fallbackGenerator.fallback(JOB, CONTEXT));
    assertThat(fallbackCount("timeout")).isEqualTo(1.0);
  }
}
