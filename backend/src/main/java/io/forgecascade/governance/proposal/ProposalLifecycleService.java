package io.forgecascade.governance.proposal;

import io.forgecascade.governance.audit.AuditEventBuilder;
import io.forgecascade.governance.audit.AuditService;
import io.forgecascade.governance.config.GovernanceProperties;
import io.forgecascade.governance.electorate.VotingWeightProvider;
import io.forgecascade.governance.exception.ForbiddenException;
import io.forgecascade.governance.exception.InvalidStateException;
import io.forgecascade.governance.exception.InvalidTransitionException;
import io.forgecascade.governance.exception.ResourceNotFoundException;
import io.forgecascade.governance.vote.TallyAggregator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns every status change of a proposal. Each transition runs on a row-locked proposal, so a
 * closure racing another closure, a vote or a withdrawal sees the committed status of whichever ran
 * first.
 */
@Service
public class ProposalLifecycleService {

  private static final Logger log = LoggerFactory.getLogger(ProposalLifecycleService.class);

  static final String TRIGGER_MANUAL = "manual";
  static final String TRIGGER_DEADLINE = "deadline";
  static final String TRIGGER_WITHDRAWAL = "withdrawal";

  private final ProposalRepository proposalRepository;
  private final TallyAggregator tallyAggregator;
  private final VotingWeightProvider votingWeightProvider;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;
  private final GovernanceProperties properties;
  private final Clock clock;

  public ProposalLifecycleService(
      ProposalRepository proposalRepository,
      TallyAggregator tallyAggregator,
      VotingWeightProvider votingWeightProvider,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher,
      GovernanceProperties properties,
      Clock clock) {
    this.proposalRepository = proposalRepository;
    this.tallyAggregator = tallyAggregator;
    this.votingWeightProvider = votingWeightProvider;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
    this.properties = properties;
    this.clock = clock;
  }

  // --- Activation ---

  /** DRAFT → ACTIVE with a caller-supplied electorate snapshot. */
  @Transactional
  public Proposal activate(
      UUID proposalId, Duration votingPeriod, double totalEligibleWeight, String aiAnalysis) {
    var proposal = lock(proposalId);
    return doActivate(proposal, votingPeriod, totalEligibleWeight, aiAnalysis);
  }

  /**
   * Activation on behalf of a member: proposer or admin only. The electorate snapshot is read from
   * the weight provider; the voting period defaults to the one chosen at creation.
   */
  @Transactional
  public Proposal activateAs(
      UUID proposalId, UUID actorId, boolean admin, Integer votingPeriodDays, String aiAnalysis) {
    var proposal = lock(proposalId);
    if (!admin && !proposal.isProposer(actorId)) {
      throw new ForbiddenException(
          "Not the proposer", "Only the proposer or an admin can activate proposal " + proposalId);
    }
    int days = votingPeriodDays != null ? votingPeriodDays : proposal.getVotingPeriodDays();
    return doActivate(
        proposal, Duration.ofDays(days), votingWeightProvider.totalEligibleWeight(), aiAnalysis);
  }

  private Proposal doActivate(
      Proposal proposal, Duration votingPeriod, double totalEligibleWeight, String aiAnalysis) {
    Duration max = properties.voting().maxPeriod();
    if (votingPeriod.compareTo(max) > 0) {
      throw new InvalidStateException(
          "Invalid voting period", "Voting period " + votingPeriod + " exceeds maximum " + max);
    }
    Instant now = clock.instant();
    proposal.activate(now, votingPeriod, totalEligibleWeight, aiAnalysis);

    auditService.log(
        AuditEventBuilder.proposal(proposal.getId(), "activated")
            .details(
                Map.of(
                    "voting_ends_at", proposal.getVotingEndsAt().toString(),
                    "total_eligible_weight", totalEligibleWeight))
            .build());

    log.info(
        "Activated proposal {}: voting until {}, electorate weight {}",
        proposal.getId(),
        proposal.getVotingEndsAt(),
        totalEligibleWeight);
    return proposal;
  }

  // --- Closure ---

  /**
   * Closes voting now, regardless of the deadline. Returns the proposal unchanged if it is already
   * past ACTIVE, so a repeated or racing call is harmless.
   *
   * @throws InvalidTransitionException if the proposal is still a DRAFT
   */
  @Transactional
  public Proposal closeVoting(UUID proposalId) {
    return closeLocked(lock(proposalId), TRIGGER_MANUAL);
  }

  /**
   * Deadline-driven closure used by the sweep. Re-checks status and deadline under the row lock;
   * returns false when another path got there first or the deadline has not passed.
   */
  @Transactional
  public boolean closeVotingIfDue(UUID proposalId) {
    var proposal = lock(proposalId);
    if (!proposal.isDeadlinePassed(clock.instant())) {
      log.debug("Proposal {} no longer due (status {})", proposalId, proposal.getStatus());
      return false;
    }
    closeLocked(proposal, TRIGGER_DEADLINE);
    return true;
  }

  private Proposal closeLocked(Proposal proposal, String trigger) {
    return switch (proposal.getStatus()) {
      case DRAFT ->
          throw new InvalidTransitionException(
              "Invalid proposal state",
              "Cannot close voting on proposal " + proposal.getId() + " in status DRAFT");
      case ACTIVE -> applyClose(proposal, trigger);
      case PASSED, REJECTED, WITHDRAWN, EXPIRED, EXECUTED, FAILED -> {
        log.debug(
            "Proposal {} already closed with status {}", proposal.getId(), proposal.getStatus());
        yield proposal;
      }
    };
  }

  private Proposal applyClose(Proposal proposal, String trigger) {
    // Guards against a vote whose tally write was lost.
    tallyAggregator.applyTo(proposal);

    var outcome = VotingOutcomeCalculator.evaluate(proposal);
    Instant now = clock.instant();
    proposal.close(outcome, now, properties.execution().timelock());

    var details = new LinkedHashMap<String, Object>();
    details.put("outcome", outcome.status().name());
    details.put("trigger", trigger);
    details.put("participation_weight", outcome.participationWeight().doubleValue());
    details.put("total_eligible_weight", proposal.getTotalEligibleWeight());
    details.put("quorum_met", outcome.quorumMet());
    if (outcome.approvalRatio() != null) {
      details.put("approval_ratio", outcome.approvalRatio().doubleValue());
    }
    var audit = AuditEventBuilder.proposal(proposal.getId(), "closed").details(details);
    if (TRIGGER_DEADLINE.equals(trigger)) {
      audit.scheduled();
    }
    auditService.log(audit.build());

    eventPublisher.publishEvent(
        new ProposalClosedEvent(proposal.getId(), outcome.status(), trigger, now));

    log.info(
        "Closed proposal {} as {} ({}): participation={}, electorate={}, ratio={}",
        proposal.getId(),
        outcome.status(),
        trigger,
        outcome.participationWeight(),
        proposal.getTotalEligibleWeight(),
        outcome.approvalRatio());
    return proposal;
  }

  // --- Withdrawal ---

  /** Proposer-only. DRAFT or ACTIVE → WITHDRAWN without evaluating votes. */
  @Transactional
  public Proposal withdraw(UUID proposalId, UUID actorId) {
    var proposal = lock(proposalId);
    if (!proposal.isProposer(actorId)) {
      throw new ForbiddenException(
          "Not the proposer", "Only the proposer can withdraw proposal " + proposalId);
    }
    var previous = proposal.getStatus();
    Instant now = clock.instant();
    proposal.withdraw(now);

    auditService.log(
        AuditEventBuilder.proposal(proposalId, "withdrawn")
            .details(Map.of("previous_status", previous.name()))
            .build());
    eventPublisher.publishEvent(
        new ProposalClosedEvent(proposalId, ProposalStatus.WITHDRAWN, TRIGGER_WITHDRAWAL, now));

    log.info("Withdrew proposal {} (was {})", proposalId, previous);
    return proposal;
  }

  // --- Execution ---

  /** PASSED → EXECUTED or FAILED, as classified from the executor's report. */
  @Transactional
  public Proposal markExecuted(UUID proposalId, ExecutionReport report) {
    var proposal = lock(proposalId);
    var result = ExecutionOutcomeClassifier.classify(report);
    Instant now = clock.instant();
    proposal.recordExecution(result, report.resultText(), now);

    var details = new LinkedHashMap<String, Object>();
    details.put("outcome", result.name());
    if (report.resultText() != null) {
      details.put("result", report.resultText());
    }
    auditService.log(
        AuditEventBuilder.proposal(proposalId, "executed")
            .details(details)
            .build());
    eventPublisher.publishEvent(new ProposalExecutedEvent(proposalId, result, now));

    log.info("Recorded execution of proposal {}: {}", proposalId, result);
    return proposal;
  }

  @Transactional
  public Proposal markExecuted(UUID proposalId, String resultText) {
    return markExecuted(proposalId, ExecutionReport.ofText(resultText));
  }

  private Proposal lock(UUID proposalId) {
    return proposalRepository
        .findByIdForUpdate(proposalId)
        .orElseThrow(() -> new ResourceNotFoundException("Proposal", proposalId));
  }
}
