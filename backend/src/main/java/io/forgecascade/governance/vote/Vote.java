package io.forgecascade.governance.vote;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One voter's position on one proposal. A second cast by the same voter revises this row in place;
 * {@code uq_votes_proposal_voter} guarantees there is never a second row.
 */
@Entity
@Table(
    name = "votes",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uq_votes_proposal_voter",
            columnNames = {"proposal_id", "voter_id"}))
public class Vote {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "proposal_id", nullable = false, updatable = false)
  private UUID proposalId;

  @Column(name = "voter_id", nullable = false, updatable = false)
  private UUID voterId;

  @Enumerated(EnumType.STRING)
  @Column(name = "decision", nullable = false, length = 10)
  private VoteDecision decision;

  @Column(name = "weight", nullable = false)
  private double weight;

  @Column(name = "reasoning", columnDefinition = "text")
  private String reasoning;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Vote() {}

  public Vote(
      UUID proposalId,
      UUID voterId,
      VoteDecision decision,
      double weight,
      String reasoning,
      Instant now) {
    this.proposalId = Objects.requireNonNull(proposalId, "proposalId must not be null");
    this.voterId = Objects.requireNonNull(voterId, "voterId must not be null");
    this.decision = Objects.requireNonNull(decision, "decision must not be null");
    this.weight = weight;
    this.reasoning = reasoning;
    this.createdAt = now;
    this.updatedAt = now;
  }

  /** Revote: takes the new decision, reasoning and the voter's weight at this moment. */
  public void revise(VoteDecision decision, double weight, String reasoning, Instant now) {
    this.decision = Objects.requireNonNull(decision, "decision must not be null");
    this.weight = weight;
    this.reasoning = reasoning;
    this.updatedAt = now;
  }

  public UUID getId() {
    return id;
  }

  public UUID getProposalId() {
    return proposalId;
  }

  public UUID getVoterId() {
    return voterId;
  }

  public VoteDecision getDecision() {
    return decision;
  }

  public double getWeight() {
    return weight;
  }

  public String getReasoning() {
    return reasoning;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
