package com.flamingo.ai.resumescreening.service.synthesis;

import com.flamingo.ai.resumescreening.report.AnalysisReport;

/**
 * Outcome of turning an oracle reply into a report: either a validated report, or the raw text
 * with the reason it was rejected.
 */
public record RepairResult(AnalysisReport report, String rawText, String reason) {

  public static RepairResult parsed(AnalysisReport report) {
    return new RepairResult(report, null, null);
  }

  public static RepairResult unparseable(String rawText, String reason) {
    return new RepairResult(null, rawText, reason);
  }

  public boolean isParsed() {
    return report != null;
  }
}
