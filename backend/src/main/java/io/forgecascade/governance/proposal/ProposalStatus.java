package io.forgecascade.governance.proposal;

/** Lifecycle status of a proposal. */
public enum ProposalStatus {
  /** Being authored; editable by the proposer. */
  DRAFT,

  /** Open for voting until {@code votingEndsAt}. */
  ACTIVE,

  /** Quorum met and approval threshold reached. Awaiting execution. */
  PASSED,

  /** Quorum met but approval threshold not reached, or only abstentions. */
  REJECTED,

  /** Pulled by the proposer before closing. */
  WITHDRAWN,

  /** Voting ended without quorum. */
  EXPIRED,

  /** Payload applied successfully. */
  EXECUTED,

  /** Payload application failed. */
  FAILED;

  /** True once no further lifecycle transition is possible. */
  public boolean isFinal() {
    return switch (this) {
      case DRAFT, ACTIVE, PASSED -> false;
      case REJECTED, WITHDRAWN, EXPIRED, EXECUTED, FAILED -> true;
    };
  }
}
