package com.flamingo.ai.resumescreening.service.synthesis;

import org.springframework.stereotype.Component;

/** Builds the recruiter prompt asking the oracle for one {@code AnalysisReport} JSON object. */
@Component
public class ReportPromptBuilder {

  private static final String SCHEMA =
      """
      - overall_score: float between 0 and 1
      - candidate_name: string (extract from resume if available)
      - summary: string (executive summary)
      - strengths: list of strings
      - weaknesses: list of strings
      - skill_matches: list of objects with skill (string), match_score (float between 0 and 1), \
      evidence (string), relevance (string)
      - experience_matches: list of objects with role (string), years_experience (number or null), \
      match_score (float between 0 and 1), evidence (string)
      - education_matches: list of objects with degree (string), field (string or null), \
      match_score (float between 0 and 1), evidence (string)
      - recommendation: string (hiring recommendation)
      - reasoning: string (detailed reasoning)
      """;

  public String build(String jobDescription, String resumeContext) {
    return "You are an expert recruiter analyzing resumes against a job description.\n\n"
        + "Job Description:\n"
        + jobDescription
        + "\n\nResume Context (Retrieved Evidence):\n"
        + resumeContext
        + "\n\nPlease analyze the resume(s) against the job description and provide a"
        + " comprehensive structured report.\n"
        + "Extract candidate information, evaluate skills, experience, and education matches,"
        + " and provide a hiring recommendation.\n\n"
        + "Return your analysis as a single JSON object with exactly these fields:\n"
        + SCHEMA
        + "\nReturn ONLY valid JSON, no additional text.";
  }
}
