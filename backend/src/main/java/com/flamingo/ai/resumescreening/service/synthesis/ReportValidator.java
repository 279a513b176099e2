package com.flamingo.ai.resumescreening.service.synthesis;

import com.flamingo.ai.resumescreening.report.AnalysisReport;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Checks a parsed report against the bean constraints declared on the report records. */
@Component
@RequiredArgsConstructor
public class ReportValidator {

  private final Validator validator;

  /**
   * Validates a report.
   *
   * @param report the report
   * @return violations as {@code path: message}, sorted; empty when valid
   */
  public List<String> validate(AnalysisReport report) {
    return validator.validate(report).stream()
        .map(ReportValidator::describe)
        .sorted()
        .toList();
  }

  private static String describe(ConstraintViolation<AnalysisReport> violation) {
    return violation.getPropertyPath() + ": " + violation.getMessage();
  }
}
