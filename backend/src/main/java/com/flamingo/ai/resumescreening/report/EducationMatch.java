package com.flamingo.ai.resumescreening.report;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

/** A degree or certification matched against the job's education requirements. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EducationMatch(
    @NotNull String degree,
    String field,
    @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double matchScore,
    @NotNull String evidence) {}
