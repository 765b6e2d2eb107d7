package io.forgecascade.governance.audit;

/** Who performed an audited action. */
public enum ActorKind {
  /** A member identified by the token subject. */
  MEMBER,
  /** The service itself or a trusted caller without a member identity. */
  SYSTEM
}
