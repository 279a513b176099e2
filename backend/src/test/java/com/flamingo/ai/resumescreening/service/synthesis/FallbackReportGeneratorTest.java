package com.flamingo.ai.resumescreening.service.synthesis;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.resumescreening.report.AnalysisReport;
import com.flamingo.ai.resumescreening.report.SkillMatch;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FallbackReportGenerator Tests")
class FallbackReportGeneratorTest {

  private final FallbackReportGenerator generator = new FallbackReportGenerator();
  private final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

  @Test
  @DisplayName("Should produce a schema-valid report with fixed fields")
  void shouldProduceValidReport() {
    AnalysisReport report = generator.fallback("Backend engineer", "Python and Kafka");

    assertThat(validator.validate(report)).isEmpty();
    assertThat(report.overallScore()).isEqualTo(0.75);
    assertThat(report.candidateName()).isEqualTo("Candidate (Extracted from Resume)");
    assertThat(report.strengths()).hasSize(3);
    assertThat(report.weaknesses()).hasSize(2);
    assertThat(report.experienceMatches()).singleElement().satisfies(
        match -> {
          assertThat(match.role()).isEqualTo("Software Engineer");
          assertThat(match.yearsExperience()).isEqualTo(3.0);
          assertThat(match.matchScore()).isEqualTo(0.8);
        });
    assertThat(report.educationMatches()).singleElement().satisfies(
        match -> {
          assertThat(match.degree()).isEqualTo("Bachelor's Degree");
          assertThat(match.field()).isEqualTo("Computer Science");
          assertThat(match.matchScore()).isEqualTo(0.9);
        });
  }

  @Test
  @DisplayName("Should match vocabulary case-insensitively with templated evidence")
  void shouldMatchSkillsCaseInsensitively() {
    AnalysisReport report = generator.fallback("jd", "Senior PYTHON developer");

    assertThat(report.skillMatches()).singleElement().satisfies(
        match -> {
          assertThat(match.skill()).isEqualTo("Python");
          assertThat(match.matchScore()).isEqualTo(0.8);
          assertThat(match.evidence()).isEqualTo("Found references to Python in resume");
          assertThat(match.relevance())
              .isEqualTo("Python is mentioned in the candidate's experience");
        });
  }

  @Test
  @DisplayName("Should report at most three skills in vocabulary order")
  void shouldCapSkillsAtThree() {
    AnalysisReport report =
        generator.fallback("jd", "python, javascript, machine learning and data pipelines");

    assertThat(report.skillMatches())
        .extracting(SkillMatch::skill)
        .containsExactly("Python", "JavaScript", "Machine Learning");
  }

  @Test
  @DisplayName("Should match short keywords inside longer words")
  void shouldMatchSubstrings() {
    AnalysisReport report = generator.fallback("jd", "Built HTML pages with Node.js");

    assertThat(report.skillMatches())
        .extracting(SkillMatch::skill)
        .containsExactly("JavaScript", "Machine Learning");
  }

  @Test
  @DisplayName("Should return no skills when nothing matches")
  void shouldReturnNoSkills_whenNoVocabularyMatch() {
    AnalysisReport report = generator.fallback("jd", "Carpenter");

    assertThat(report.skillMatches()).isEmpty();
    assertThat(validator.validate(report)).isEmpty();
  }

  @Test
  @DisplayName("Should be deterministic")
  void shouldBeDeterministic() {
    assertThat(generator.fallback("jd", "python data"))
        .isEqualTo(generator.fallback("jd", "python data"));
  }
}
