package com.flamingo.ai.resumescreening.service.synthesis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.flamingo.ai.resumescreening.report.AnalysisReport;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Extracts and validates the report JSON from a free-text oracle reply.
 *
 * <p>Handles replies wrapped in {@code ```json} or bare {@code ```} fences and replies with prose
 * around the object. Anything that does not yield a valid report is {@link
 * RepairResult#unparseable}.
 */
@Component
@Slf4j
public class ReportResponseRepairer {

  private static final String JSON_FENCE = "```json";
  private static final String FENCE = "```";

  private final ObjectReader reportReader;
  private final ReportValidator reportValidator;

  public ReportResponseRepairer(ObjectMapper objectMapper, ReportValidator reportValidator) {
    this.reportReader =
        objectMapper
            .readerFor(AnalysisReport.class)
            .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    this.reportValidator = reportValidator;
  }

  public RepairResult repair(String rawText) {
    if (rawText == null || rawText.isBlank()) {
      return RepairResult.unparseable(rawText, "empty response");
    }

    String candidate = extractJson(rawText);
    if (candidate == null) {
      return RepairResult.unparseable(rawText, "no JSON object found");
    }

    AnalysisReport report;
    try {
      report = reportReader.readValue(candidate);
    } catch (JsonProcessingException e) {
      log.debug("Report JSON did not parse: {}", e.getOriginalMessage());
      return RepairResult.unparseable(rawText, "invalid JSON: " + e.getOriginalMessage());
    }
    if (report == null) {
      return RepairResult.unparseable(rawText, "null report");
    }

    List<String> violations = reportValidator.validate(report);
    if (!violations.isEmpty()) {
      return RepairResult.unparseable(rawText, "schema violations: " + violations);
    }
    return RepairResult.parsed(report);
  }

  /** Returns the most likely JSON object text, or null when the reply holds no braces. */
  static String extractJson(String rawText) {
    String cleaned = rawText.strip();

    int jsonFence = cleaned.indexOf(JSON_FENCE);
    if (jsonFence >= 0) {
      cleaned = fenceBody(cleaned, jsonFence + JSON_FENCE.length());
    } else {
      int fence = cleaned.indexOf(FENCE);
      if (fence >= 0) {
        int bodyStart = fence + FENCE.length();
        int bodyEnd = cleaned.indexOf(FENCE, bodyStart);
        if (bodyEnd > bodyStart) {
          cleaned = cleaned.substring(bodyStart, bodyEnd).strip();
        }
      }
    }

    if (cleaned.startsWith("{") && cleaned.endsWith("}")) {
      return cleaned;
    }
    int start = cleaned.indexOf('{');
    int end = cleaned.lastIndexOf('}');
    if (start >= 0 && end > start) {
      return cleaned.substring(start, end + 1);
    }
    return null;
  }

  private static String fenceBody(String text, int bodyStart) {
    int bodyEnd = text.indexOf(FENCE, bodyStart);
    return (bodyEnd >= 0 ? text.substring(bodyStart, bodyEnd) : text.substring(bodyStart)).strip();
  }
}
