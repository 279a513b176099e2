package com.flamingo.ai.resumescreening.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Structured evaluation of one candidate against one job description.
 *
 * <p>Serialized with snake_case field names; the same shape is requested from the oracle. {@code
 * documentId} and {@code filename} are not part of the oracle output and are stamped on by the
 * ranker.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisReport(
    @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double overallScore,
    @NotNull String candidateName,
    @NotNull String summary,
    @NotNull List<@NotNull String> strengths,
    @NotNull List<@NotNull String> weaknesses,
    @NotNull List<@NotNull @Valid SkillMatch> skillMatches,
    @NotNull List<@NotNull @Valid ExperienceMatch> experienceMatches,
    @NotNull List<@NotNull @Valid EducationMatch> educationMatches,
    @NotNull String recommendation,
    @NotNull String reasoning,
    String documentId,
    String filename) {

  /** Returns a copy attributed to the given resume. */
  public AnalysisReport withSource(String documentId, String filename) {
    return new AnalysisReport(
        overallScore,
        candidateName,
        summary,
        strengths,
        weaknesses,
        skillMatches,
        experienceMatches,
        educationMatches,
        recommendation,
        reasoning,
        documentId,
        filename);
  }
}
