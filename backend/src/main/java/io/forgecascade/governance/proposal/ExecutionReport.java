package io.forgecascade.governance.proposal;

/**
 * What the external executor reports after applying a PASSED proposal.
 *
 * @param success explicit outcome; null to let {@link ExecutionOutcomeClassifier} read the text
 * @param resultText free-form result, stored verbatim
 */
public record ExecutionReport(Boolean success, String resultText) {

  public static ExecutionReport ofText(String resultText) {
    return new ExecutionReport(null, resultText);
  }
}
