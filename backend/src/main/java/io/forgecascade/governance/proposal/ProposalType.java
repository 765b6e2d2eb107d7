package io.forgecascade.governance.proposal;

/** What a proposal is about. Does not affect voting math. */
public enum ProposalType {
  POLICY,
  SYSTEM,
  OVERLAY,
  CAPSULE,
  TRUST,
  CONSTITUTIONAL
}
