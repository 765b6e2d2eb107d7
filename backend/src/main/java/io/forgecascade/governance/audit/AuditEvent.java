package io.forgecascade.governance.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/** One row of the governance audit trail. The table rejects updates. */
@Entity
@Immutable
@Table(name = "audit_events")
public class AuditEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "event_type", nullable = false, length = 100)
  private String eventType;

  @Column(name = "entity_type", nullable = false, length = 50)
  private String entityType;

  @Column(name = "entity_id", nullable = false)
  private UUID entityId;

  @Column(name = "proposal_id")
  private UUID proposalId;

  @Column(name = "actor_id")
  private UUID actorId;

  @Enumerated(EnumType.STRING)
  @Column(name = "actor_kind", nullable = false, length = 10)
  private ActorKind actorKind;

  @Enumerated(EnumType.STRING)
  @Column(name = "origin", nullable = false, length = 10)
  private AuditOrigin origin;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "details", columnDefinition = "jsonb")
  private Map<String, Object> details;

  @Column(name = "occurred_at", nullable = false)
  private Instant occurredAt;

  protected AuditEvent() {}

  AuditEvent(AuditEventRecord record, Instant occurredAt) {
    this.eventType = record.eventType();
    this.entityType = record.entityType();
    this.entityId = record.entityId();
    this.proposalId = record.proposalId();
    this.actorId = record.actorId();
    this.actorKind = record.actorKind();
    this.origin = record.origin();
    this.details = record.details();
    this.occurredAt = occurredAt;
  }

  public UUID getId() {
    return id;
  }

  public String getEventType() {
    return eventType;
  }

  public String getEntityType() {
    return entityType;
  }

  public UUID getEntityId() {
    return entityId;
  }

  public UUID getProposalId() {
    return proposalId;
  }

  public UUID getActorId() {
    return actorId;
  }

  public ActorKind getActorKind() {
    return actorKind;
  }

  public AuditOrigin getOrigin() {
    return origin;
  }

  public Map<String, Object> getDetails() {
    return details;
  }

  public Instant getOccurredAt() {
    return occurredAt;
  }
}
