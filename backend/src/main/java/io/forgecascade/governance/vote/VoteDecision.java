package io.forgecascade.governance.vote;

import io.forgecascade.governance.exception.InvalidDecisionException;
import java.util.List;
import java.util.Locale;

public enum VoteDecision {
  FOR,
  AGAINST,
  ABSTAIN;

  private static final List<String> ACCEPTED =
      List.of("FOR", "AGAINST", "ABSTAIN", "APPROVE", "REJECT", "YES", "NO");

  /**
   * Parses a client-supplied decision. Accepts the canonical names plus APPROVE/YES for FOR and
   * REJECT/NO for AGAINST, ignoring case and surrounding whitespace.
   */
  public static VoteDecision fromString(String value) {
    if (value == null) {
      throw new InvalidDecisionException("null", ACCEPTED);
    }
    return switch (value.trim().toUpperCase(Locale.ROOT)) {
      case "FOR", "APPROVE", "YES" -> FOR;
      case "AGAINST", "REJECT", "NO" -> AGAINST;
      case "ABSTAIN" -> ABSTAIN;
      default -> throw new InvalidDecisionException(value, ACCEPTED);
    };
  }
}
