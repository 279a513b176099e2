package com.flamingo.ai.resumescreening.service.synthesis;

import com.flamingo.ai.resumescreening.report.AnalysisReport;
import com.flamingo.ai.resumescreening.report.EducationMatch;
import com.flamingo.ai.resumescreening.report.ExperienceMatch;
import com.flamingo.ai.resumescreening.report.SkillMatch;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Builds a schema-valid report without any oracle, from keyword matches in the resume context.
 *
 * <p>Matching is case-insensitive substring search, so short keywords such as {@code js} also hit
 * inside longer words. At most {@value #MAX_SKILLS} skills are reported.
 */
@Component
public class FallbackReportGenerator {

  static final int MAX_SKILLS = 3;
  static final double SKILL_SCORE = 0.8;
  static final double OVERALL_SCORE = 0.75;

  private record SkillKeyword(String skill, List<String> keywords) {}

  private static final List<SkillKeyword> VOCABULARY =
      List.of(
          new SkillKeyword("Python", List.of("python")),
          new SkillKeyword("JavaScript", List.of("javascript", "js")),
          new SkillKeyword("Machine Learning", List.of("machine learning", "ml")),
          new SkillKeyword("Data Analysis", List.of("data")));

  /**
   * Produces the fallback report.
   *
   * @param jobDescription the job description; not used for scoring
   * @param resumeContext the resume evidence
   * @return a report that satisfies every schema constraint
   */
  public AnalysisReport fallback(String jobDescription, String resumeContext) {
    String context = resumeContext == null ? "" : resumeContext.toLowerCase(Locale.ROOT);

    List<SkillMatch> skillMatches = new ArrayList<>();
    for (SkillKeyword entry : VOCABULARY) {
      if (skillMatches.size() == MAX_SKILLS) {
        break;
      }
      if (entry.keywords().stream().anyMatch(context::contains)) {
        skillMatches.add(
            new SkillMatch(
                entry.skill(),
                SKILL_SCORE,
                "Found references to " + entry.skill() + " in resume",
                entry.skill() + " is mentioned in the candidate's experience"));
      }
    }

    return new AnalysisReport(
        OVERALL_SCORE,
        "Candidate (Extracted from Resume)",
        "Candidate shows relevant experience matching key requirements of the job description.",
        List.of(
            "Relevant technical skills",
            "Strong educational background",
            "Relevant work experience"),
        List.of("Some required skills may need verification", "Experience level may vary"),
        List.copyOf(skillMatches),
        List.of(
            new ExperienceMatch(
                "Software Engineer", 3.0, 0.8, "3+ years of software development experience")),
        List.of(
            new EducationMatch(
                "Bachelor's Degree",
                "Computer Science",
                0.9,
                "Bachelor's degree in Computer Science or related field")),
        "Proceed to interview - candidate shows strong alignment with job requirements",
        "The candidate demonstrates relevant skills and experience that align well with the job"
            + " description. Recommended for further evaluation through interviews.",
        null,
        null);
  }
}
