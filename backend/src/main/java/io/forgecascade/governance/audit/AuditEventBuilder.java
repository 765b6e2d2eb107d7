package io.forgecascade.governance.audit;

import io.forgecascade.governance.security.CurrentActor;
import java.util.Map;
import java.util.UUID;
import org.springframework.web.context.request.RequestContextHolder;

/**
 * Builds {@link AuditEventRecord}s. Start from the subject of the event:
 *
 * <pre>{@code
 * AuditEventBuilder.proposal(proposal.getId(), "activated")
 *     .details(Map.of("voting_ends_at", proposal.getVotingEndsAt().toString()))
 *     .build();
 * }</pre>
 *
 * <p>Without an explicit {@link #actor(UUID)} the actor is the JWT subject of the current request.
 */
public final class AuditEventBuilder {

  private final String eventType;
  private final String entityType;
  private final UUID entityId;
  private final UUID proposalId;

  private UUID actorId;
  private boolean actorSet;
  private boolean scheduled;
  private Map<String, Object> details;

  private AuditEventBuilder(String entityType, UUID entityId, UUID proposalId, String action) {
    this.eventType = entityType + "." + action;
    this.entityType = entityType;
    this.entityId = entityId;
    this.proposalId = proposalId;
  }

  public static AuditEventBuilder proposal(UUID proposalId, String action) {
    return new AuditEventBuilder("proposal", proposalId, proposalId, action);
  }

  public static AuditEventBuilder vote(UUID voteId, UUID proposalId, String action) {
    return new AuditEventBuilder("vote", voteId, proposalId, action);
  }

  /** Events that do not belong to a single proposal: electorate, delegation, security. */
  public static AuditEventBuilder of(String entityType, UUID entityId, String action) {
    return new AuditEventBuilder(entityType, entityId, null, action);
  }

  public AuditEventBuilder actor(UUID actorId) {
    this.actorId = actorId;
    this.actorSet = true;
    return this;
  }

  /** The deadline sweep acted; no member is involved. */
  public AuditEventBuilder scheduled() {
    this.scheduled = true;
    return actor(null);
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  public AuditEventRecord build() {
    UUID resolvedActor = actorSet ? actorId : CurrentActor.actorId().orElse(null);
    ActorKind kind = resolvedActor != null ? ActorKind.MEMBER : ActorKind.SYSTEM;
    AuditOrigin origin;
    if (scheduled) {
      origin = AuditOrigin.SCHEDULED;
    } else if (RequestContextHolder.getRequestAttributes() != null) {
      origin = AuditOrigin.API;
    } else {
      origin = AuditOrigin.INTERNAL;
    }
    return new AuditEventRecord(
        eventType, entityType, entityId, proposalId, resolvedActor, kind, origin, details);
  }
}
