package com.flamingo.ai.resumescreening.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for analyzing resumes against a job description. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyzeRequest {

  @NotBlank(message = "Job description is required")
  private String jobDescription;

  /** Chunks retrieved across all resumes; the configured default when absent. */
  @Positive private Integer topK;
}
