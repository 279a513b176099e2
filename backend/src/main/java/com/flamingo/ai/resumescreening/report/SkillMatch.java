package com.flamingo.ai.resumescreening.report;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

/** A skill required by the job and the resume evidence for it. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SkillMatch(
    @NotNull String skill,
    @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double matchScore,
    @NotNull String evidence,
    @NotNull String relevance) {}
