package io.forgecascade.governance.proposal;

import io.forgecascade.governance.exception.InvalidStateException;
import io.forgecascade.governance.exception.InvalidTransitionException;
import io.forgecascade.governance.vote.VoteTally;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A community proposal and its running tally.
 *
 * <p>Lifecycle: DRAFT → ACTIVE → PASSED | REJECTED | EXPIRED | WITHDRAWN, then PASSED → EXECUTED |
 * FAILED. Only DRAFT proposals are editable. Tally fields are written exclusively through {@link
 * #applyTally(VoteTally)}.
 */
@Entity
@Table(name = "proposals")
public class Proposal {

  private static final double WEIGHT_TOLERANCE = 1e-9;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "title", nullable = false, length = 200)
  private String title;

  @Column(name = "description", nullable = false, columnDefinition = "text")
  private String description;

  @Enumerated(EnumType.STRING)
  @Column(name = "type", nullable = false, length = 20)
  private ProposalType type;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ProposalStatus status;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "payload", nullable = false, columnDefinition = "jsonb")
  private Map<String, Object> payload = Map.of();

  @Column(name = "proposer_id", nullable = false, updatable = false)
  private UUID proposerId;

  // --- Voting configuration ---

  @Column(name = "voting_period_days", nullable = false)
  private int votingPeriodDays;

  @Column(name = "quorum_percentage", nullable = false, precision = 5, scale = 4)
  private BigDecimal quorumPercentage;

  @Column(name = "approval_threshold", nullable = false, precision = 5, scale = 4)
  private BigDecimal approvalThreshold;

  // --- Tally ---

  @Column(name = "votes_for", nullable = false)
  private int votesFor;

  @Column(name = "votes_against", nullable = false)
  private int votesAgainst;

  @Column(name = "votes_abstain", nullable = false)
  private int votesAbstain;

  @Column(name = "weight_for", nullable = false)
  private double weightFor;

  @Column(name = "weight_against", nullable = false)
  private double weightAgainst;

  @Column(name = "weight_abstain", nullable = false)
  private double weightAbstain;

  @Column(name = "total_eligible_weight", nullable = false)
  private double totalEligibleWeight;

  // --- Lifecycle timestamps ---

  @Column(name = "voting_starts_at")
  private Instant votingStartsAt;

  @Column(name = "voting_ends_at")
  private Instant votingEndsAt;

  @Column(name = "closed_at")
  private Instant closedAt;

  @Column(name = "execution_allowed_after")
  private Instant executionAllowedAfter;

  @Column(name = "executed_at")
  private Instant executedAt;

  @Column(name = "execution_result", columnDefinition = "text")
  private String executionResult;

  /** Advisory annotation from an external reviewer. Stored and returned verbatim. */
  @Column(name = "ai_analysis", columnDefinition = "text")
  private String aiAnalysis;

  /** Written only by {@link ProposalRepository#recordCloseFailure}. */
  @Column(name = "close_failures", nullable = false, insertable = false, updatable = false)
  private int closeFailures;

  @Column(name = "last_close_failure_at", insertable = false, updatable = false)
  private Instant lastCloseFailureAt;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Proposal() {}

  public Proposal(
      String title,
      String description,
      ProposalType type,
      Map<String, Object> payload,
      UUID proposerId,
      int votingPeriodDays,
      BigDecimal quorumPercentage,
      BigDecimal approvalThreshold,
      Instant now) {
    this.title = Objects.requireNonNull(title, "title must not be null");
    this.description = Objects.requireNonNull(description, "description must not be null");
    this.type = Objects.requireNonNull(type, "type must not be null");
    this.payload = payload != null ? payload : Map.of();
    this.proposerId = Objects.requireNonNull(proposerId, "proposerId must not be null");
    this.votingPeriodDays = votingPeriodDays;
    this.quorumPercentage =
        Objects.requireNonNull(quorumPercentage, "quorumPercentage must not be null");
    this.approvalThreshold =
        Objects.requireNonNull(approvalThreshold, "approvalThreshold must not be null");
    this.status = ProposalStatus.DRAFT;
    this.createdAt = now;
    this.updatedAt = now;
  }

  // --- Lifecycle transitions ---

  /** Opens voting. Only valid from DRAFT. */
  public void activate(
      Instant now, Duration votingPeriod, double totalEligibleWeight, String aiAnalysis) {
    requireStatus(Set.of(ProposalStatus.DRAFT), "activate");
    if (votingPeriod.isNegative() || votingPeriod.isZero()) {
      throw new InvalidStateException(
          "Invalid voting period", "Voting period must be positive, got " + votingPeriod);
    }
    if (totalEligibleWeight < 0) {
      throw new InvalidStateException(
          "Invalid electorate", "Total eligible weight must not be negative");
    }
    this.status = ProposalStatus.ACTIVE;
    this.votingStartsAt = now;
    this.votingEndsAt = now.plus(votingPeriod);
    this.totalEligibleWeight = totalEligibleWeight;
    if (aiAnalysis != null) {
      this.aiAnalysis = aiAnalysis;
    }
    this.updatedAt = now;
  }

  /**
   * Overwrites the six tally fields. Returns false when the values were already current, so
   * re-applying an unchanged tally does not touch the row.
   */
  public boolean applyTally(VoteTally tally) {
    if (tally.votesFor() == votesFor
        && tally.votesAgainst() == votesAgainst
        && tally.votesAbstain() == votesAbstain
        && Double.compare(tally.weightFor(), weightFor) == 0
        && Double.compare(tally.weightAgainst(), weightAgainst) == 0
        && Double.compare(tally.weightAbstain(), weightAbstain) == 0) {
      return false;
    }
    this.votesFor = tally.votesFor();
    this.votesAgainst = tally.votesAgainst();
    this.votesAbstain = tally.votesAbstain();
    this.weightFor = tally.weightFor();
    this.weightAgainst = tally.weightAgainst();
    this.weightAbstain = tally.weightAbstain();
    return true;
  }

  /**
   * Records the outcome of closing. Only valid from ACTIVE. A PASSED proposal may be executed once
   * {@code timelock} has elapsed.
   */
  public void close(VotingOutcome outcome, Instant now, Duration timelock) {
    requireStatus(Set.of(ProposalStatus.ACTIVE), "close voting on");
    var target = outcome.status();
    if (target != ProposalStatus.PASSED
        && target != ProposalStatus.REJECTED
        && target != ProposalStatus.EXPIRED) {
      throw new IllegalArgumentException("Not a voting outcome: " + target);
    }
    this.status = target;
    this.closedAt = now;
    if (target == ProposalStatus.PASSED) {
      this.executionAllowedAfter = now.plus(timelock);
    }
    this.updatedAt = now;
  }

  /** Pulls the proposal without evaluating votes. Valid from DRAFT or ACTIVE. */
  public void withdraw(Instant now) {
    requireStatus(Set.of(ProposalStatus.DRAFT, ProposalStatus.ACTIVE), "withdraw");
    this.status = ProposalStatus.WITHDRAWN;
    this.closedAt = now;
    this.updatedAt = now;
  }

  /** Records the executor's report. Only valid from PASSED, and not before the timelock ends. */
  public void recordExecution(ProposalStatus result, String resultText, Instant now) {
    requireStatus(Set.of(ProposalStatus.PASSED), "record execution of");
    if (result != ProposalStatus.EXECUTED && result != ProposalStatus.FAILED) {
      throw new IllegalArgumentException("Not an execution result: " + result);
    }
    if (executionAllowedAfter != null && now.isBefore(executionAllowedAfter)) {
      throw new InvalidTransitionException(
          "Execution timelock active",
          "Proposal " + id + " cannot be executed before " + executionAllowedAfter);
    }
    this.status = result;
    this.executedAt = now;
    this.executionResult = resultText;
    this.updatedAt = now;
  }

  /** Replaces editable content. Only valid from DRAFT; null arguments keep the current value. */
  public void updateContent(
      String title, String description, Map<String, Object> payload, Instant now) {
    if (status != ProposalStatus.DRAFT) {
      throw new InvalidTransitionException(
          "Proposal not editable", "Cannot edit proposal in status " + status);
    }
    if (title != null) {
      this.title = title;
    }
    if (description != null) {
      this.description = description;
    }
    if (payload != null) {
      this.payload = payload;
    }
    this.updatedAt = now;
  }

  // --- Guards ---

  /** ACTIVE and the voting window has not ended. */
  public boolean isVotingOpen(Instant now) {
    return status == ProposalStatus.ACTIVE && votingEndsAt != null && now.isBefore(votingEndsAt);
  }

  public boolean isDeadlinePassed(Instant now) {
    return status == ProposalStatus.ACTIVE && votingEndsAt != null && !now.isBefore(votingEndsAt);
  }

  /** Weight cast so far across all three decisions. */
  public double getParticipationWeight() {
    return weightFor + weightAgainst + weightAbstain;
  }

  /**
   * Whether {@code participation} fits inside the electorate snapshot. Allows for rounding in the
   * summed weights.
   */
  public boolean isWithinElectorate(double participation) {
    double tolerance = WEIGHT_TOLERANCE * Math.max(1.0, totalEligibleWeight);
    return participation <= totalEligibleWeight + tolerance;
  }

  public boolean isProposer(UUID memberId) {
    return proposerId.equals(memberId);
  }

  private void requireStatus(Set<ProposalStatus> allowedStatuses, String action) {
    if (!allowedStatuses.contains(this.status)) {
      throw new InvalidTransitionException(
          "Invalid proposal state",
          "Cannot "
              + action
              + " proposal in status "
              + this.status
              + ". Allowed: "
              + allowedStatuses);
    }
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public ProposalType getType() {
    return type;
  }

  public ProposalStatus getStatus() {
    return status;
  }

  public Map<String, Object> getPayload() {
    return payload;
  }

  public UUID getProposerId() {
    return proposerId;
  }

  public int getVotingPeriodDays() {
    return votingPeriodDays;
  }

  public BigDecimal getQuorumPercentage() {
    return quorumPercentage;
  }

  public BigDecimal getApprovalThreshold() {
    return approvalThreshold;
  }

  public int getVotesFor() {
    return votesFor;
  }

  public int getVotesAgainst() {
    return votesAgainst;
  }

  public int getVotesAbstain() {
    return votesAbstain;
  }

  public double getWeightFor() {
    return weightFor;
  }

  public double getWeightAgainst() {
    return weightAgainst;
  }

  public double getWeightAbstain() {
    return weightAbstain;
  }

  public double getTotalEligibleWeight() {
    return totalEligibleWeight;
  }

  public Instant getVotingStartsAt() {
    return votingStartsAt;
  }

  public Instant getVotingEndsAt() {
    return votingEndsAt;
  }

  public Instant getClosedAt() {
    return closedAt;
  }

  public Instant getExecutionAllowedAfter() {
    return executionAllowedAfter;
  }

  public Instant getExecutedAt() {
    return executedAt;
  }

  public String getExecutionResult() {
    return executionResult;
  }

  public String getAiAnalysis() {
    return aiAnalysis;
  }

  public int getCloseFailures() {
    return closeFailures;
  }

  public Instant getLastCloseFailureAt() {
    return lastCloseFailureAt;
  }

  public long getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
