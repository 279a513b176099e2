package com.flamingo.ai.resumescreening.report;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/** A role from the resume matched against the job's experience requirements. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ExperienceMatch(
    @NotNull String role,
    @PositiveOrZero Double yearsExperience,
    @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double matchScore,
    @NotNull String evidence) {}
