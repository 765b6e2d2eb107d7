package io.forgecascade.governance.delegation;

import io.forgecascade.governance.proposal.ProposalType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A member's standing instruction that another member may speak for them. There is at most one
 * row per (delegator, delegate) pair; delegating again renews it in place.
 *
 * <p>An empty type list covers every proposal type. Delegations are recorded intent only: they
 * never add weight to a tally.
 */
@Entity
@Table(
    name = "vote_delegations",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uq_vote_delegations_pair",
            columnNames = {"delegator_id", "delegate_id"}))
public class VoteDelegation {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "delegator_id", nullable = false, updatable = false)
  private UUID delegatorId;

  @Column(name = "delegate_id", nullable = false, updatable = false)
  private UUID delegateId;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "proposal_types", nullable = false, columnDefinition = "jsonb")
  private List<String> proposalTypes = List.of();

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "expires_at")
  private Instant expiresAt;

  @Column(name = "revoked_at")
  private Instant revokedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected VoteDelegation() {}

  public VoteDelegation(
      UUID delegatorId,
      UUID delegateId,
      Collection<ProposalType> proposalTypes,
      Instant expiresAt,
      Instant now) {
    this.delegatorId = Objects.requireNonNull(delegatorId, "delegatorId must not be null");
    this.delegateId = Objects.requireNonNull(delegateId, "delegateId must not be null");
    this.proposalTypes = names(proposalTypes);
    this.active = true;
    this.expiresAt = expiresAt;
    this.createdAt = now;
    this.updatedAt = now;
  }

  /** Replaces scope and expiry, reactivating a revoked delegation. */
  public void renew(Collection<ProposalType> proposalTypes, Instant expiresAt, Instant now) {
    this.proposalTypes = names(proposalTypes);
    this.expiresAt = expiresAt;
    this.active = true;
    this.revokedAt = null;
    this.updatedAt = now;
  }

  /** Returns false if already revoked. */
  public boolean revoke(Instant now) {
    if (!active) {
      return false;
    }
    this.active = false;
    this.revokedAt = now;
    this.updatedAt = now;
    return true;
  }

  public boolean isEffective(Instant now) {
    return active && (expiresAt == null || expiresAt.isAfter(now));
  }

  public boolean covers(ProposalType type) {
    return proposalTypes.isEmpty() || proposalTypes.contains(type.name());
  }

  public boolean isDelegator(UUID memberId) {
    return delegatorId.equals(memberId);
  }

  private static List<String> names(Collection<ProposalType> types) {
    if (types == null || types.isEmpty()) {
      return List.of();
    }
    return EnumSet.copyOf(types).stream().map(Enum::name).toList();
  }

  public UUID getId() {
    return id;
  }

  public UUID getDelegatorId() {
    return delegatorId;
  }

  public UUID getDelegateId() {
    return delegateId;
  }

  /** Empty means every type. */
  public Set<ProposalType> getProposalTypes() {
    var types = EnumSet.noneOf(ProposalType.class);
    for (String name : proposalTypes) {
      types.add(ProposalType.valueOf(name));
    }
    return types;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public Instant getRevokedAt() {
    return revokedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
