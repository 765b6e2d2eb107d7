package io.forgecascade.governance.audit;

import java.util.Map;
import java.util.UUID;

/**
 * What {@link AuditService#log(AuditEventRecord)} persists. Built with {@link AuditEventBuilder}.
 *
 * @param eventType {@code {entity}.{action}}, e.g. {@code vote.changed}
 * @param proposalId the proposal the event belongs to; null for electorate and security events
 * @param actorId acting member; null when {@code actorKind} is SYSTEM
 * @param details small JSON object of the values that changed; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    UUID proposalId,
    UUID actorId,
    ActorKind actorKind,
    AuditOrigin origin,
    Map<String, Object> details) {}
