package io.forgecascade.governance.audit;

public enum AuditOrigin {
  /** Inside an HTTP request. */
  API,
  /** Called in-process outside any request, e.g. from an event listener or a test. */
  INTERNAL,
  /** Driven by the voting deadline sweep. */
  SCHEDULED
}
