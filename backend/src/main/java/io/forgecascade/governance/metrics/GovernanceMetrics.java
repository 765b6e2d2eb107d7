package io.forgecascade.governance.metrics;

import io.forgecascade.governance.proposal.ProposalClosedEvent;
import io.forgecascade.governance.proposal.ProposalExecutedEvent;
import io.forgecascade.governance.vote.VoteCastEvent;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Micrometer counters for governance activity. Event-driven counters only move after the
 * originating transaction commits, so rolled-back votes and closures are never counted.
 */
@Component
public class GovernanceMetrics {

  private static final Logger log = LoggerFactory.getLogger(GovernanceMetrics.class);

  public static final String VOTES_CAST = "governance.votes.cast";
  public static final String PROPOSALS_CLOSED = "governance.proposals.closed";
  public static final String PROPOSALS_EXECUTED = "governance.proposals.executed";
  public static final String SWEEP_CLOSED = "governance.deadline.sweep.closed";
  public static final String SWEEP_FAILED = "governance.deadline.sweep.failed";

  private final MeterRegistry meterRegistry;

  public GovernanceMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onVoteCast(VoteCastEvent event) {
    meterRegistry
        .counter(
            VOTES_CAST,
            "decision",
            event.decision().name(),
            "revote",
            String.valueOf(event.revote()))
        .increment();
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onProposalClosed(ProposalClosedEvent event) {
    meterRegistry
        .counter(
            PROPOSALS_CLOSED, "outcome", event.outcome().name(), "trigger", event.trigger())
        .increment();
    log.debug("Counted closure of proposal {} as {}", event.proposalId(), event.outcome());
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onProposalExecuted(ProposalExecutedEvent event) {
    meterRegistry.counter(PROPOSALS_EXECUTED, "outcome", event.outcome().name()).increment();
  }

  public void recordSweep(int closed, int failed) {
    meterRegistry.counter(SWEEP_CLOSED).increment(closed);
    meterRegistry.counter(SWEEP_FAILED).increment(failed);
  }
}
