package io.forgecascade.governance.proposal;

import java.util.List;
import java.util.Locale;

/**
 * Maps an executor report to EXECUTED or FAILED. An explicit flag wins; otherwise a result text
 * starting with one of the failure markers counts as a failure, and anything else as success.
 */
public final class ExecutionOutcomeClassifier {

  private static final List<String> FAILURE_MARKERS = List.of("FAILED", "FAILURE", "ERROR");

  private ExecutionOutcomeClassifier() {}

  public static ProposalStatus classify(ExecutionReport report) {
    if (report.success() != null) {
      return report.success() ? ProposalStatus.EXECUTED : ProposalStatus.FAILED;
    }
    String text = report.resultText();
    if (text == null) {
      return ProposalStatus.EXECUTED;
    }
    String normalized = text.stripLeading().toUpperCase(Locale.ROOT);
    for (String marker : FAILURE_MARKERS) {
      if (normalized.startsWith(marker)) {
        return ProposalStatus.FAILED;
      }
    }
    return ProposalStatus.EXECUTED;
  }
}
