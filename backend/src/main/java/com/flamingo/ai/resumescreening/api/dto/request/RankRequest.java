package com.flamingo.ai.resumescreening.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for ranking every resume against a job description. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankRequest {

  @NotBlank(message = "Job description is required")
  private String jobDescription;

  @Positive private Integer topKPerDocument;

  /** 0 or negative ranks every resume. */
  private Integer maxDocuments;
}
