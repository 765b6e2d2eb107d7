package io.forgecascade.governance.exception;

/**
 * Stable machine-readable codes carried in the {@code code} property of every problem response.
 * Clients branch on these, never on titles or detail text.
 */
public final class ErrorCodes {

  public static final String PROPERTY = "code";

  public static final String INVALID_TRANSITION = "INVALID_TRANSITION";
  public static final String PROPOSAL_NOT_ACTIVE = "PROPOSAL_NOT_ACTIVE";
  public static final String INVALID_DECISION = "INVALID_DECISION";
  public static final String INVALID_PAYLOAD = "INVALID_PAYLOAD";
  public static final String VALIDATION_FAILED = "VALIDATION_FAILED";
  public static final String STORE_UNAVAILABLE = "STORE_UNAVAILABLE";
  public static final String UNAUTHORIZED = "UNAUTHORIZED";
  public static final String CONCURRENT_MODIFICATION = "CONCURRENT_MODIFICATION";
  public static final String ELECTORATE_WEIGHT_EXCEEDED = "ELECTORATE_WEIGHT_EXCEEDED";

  private ErrorCodes() {}

  /** e.g. "Proposal" becomes {@code PROPOSAL_NOT_FOUND}. */
  public static String notFound(String resourceType) {
    return resourceType.toUpperCase().replace(' ', '_') + "_NOT_FOUND";
  }
}
