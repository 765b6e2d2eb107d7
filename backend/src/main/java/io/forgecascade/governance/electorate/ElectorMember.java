package io.forgecascade.governance.electorate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Read model of one member's trust standing, pushed by the identity/trust system. The member ID is
 * the same UUID that appears as the JWT subject.
 */
@Entity
@Table(name = "electorate_members")
public class ElectorMember {

  @Id
  @Column(name = "member_id", nullable = false, updatable = false)
  private UUID memberId;

  @Column(name = "trust_score", nullable = false)
  private int trustScore;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ElectorMember() {}

  public ElectorMember(UUID memberId, int trustScore, boolean active, Instant now) {
    this.memberId = memberId;
    this.trustScore = trustScore;
    this.active = active;
    this.createdAt = now;
    this.updatedAt = now;
  }

  /** Returns true if anything changed. */
  public boolean updateStanding(int trustScore, boolean active, Instant now) {
    if (this.trustScore == trustScore && this.active == active) {
      return false;
    }
    this.trustScore = trustScore;
    this.active = active;
    this.updatedAt = now;
    return true;
  }

  public UUID getMemberId() {
    return memberId;
  }

  public int getTrustScore() {
    return trustScore;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
